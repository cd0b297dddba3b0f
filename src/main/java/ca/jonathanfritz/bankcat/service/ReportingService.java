package ca.jonathanfritz.bankcat.service;

import ca.jonathanfritz.bankcat.cli.CLI;
import ca.jonathanfritz.bankcat.transactions.CategorizedTransaction;
import ca.jonathanfritz.bankcat.transactions.Transaction;
import com.google.common.collect.Streams;
import com.google.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class ReportingService {

    public static final DecimalFormat CURRENCY_FORMATTER = new DecimalFormat("0.00");
    public static final String CSV_DELIMITER = ", ";

    private final CLI cli;

    @Inject
    public ReportingService(CLI cli) {
        this.cli = cli;
    }

    /**
     * Prints the number of transactions and the total amount in each category, most frequent category first
     */
    public void reportCategoryStatistics(List<CategorizedTransaction> transactions) {
        cli.println(Streams.concat(
                Stream.of("CATEGORY" + CSV_DELIMITER + "COUNT" + CSV_DELIMITER + "TOTAL"),
                getCategoryStatistics(transactions).stream()
                        .map(s -> s.category() + CSV_DELIMITER + s.count() + CSV_DELIMITER + CURRENCY_FORMATTER.format(s.totalAmount()))
        ).collect(Collectors.toList()));
    }

    /**
     * Prints the type and description of every transaction that the rule table could not resolve, newest first
     */
    public void reportUnresolvedTransactions(List<CategorizedTransaction> transactions) {
        final List<CategorizedTransaction> unresolved = findUnresolvedTransactions(transactions);
        if (unresolved.isEmpty()) {
            cli.println("All transactions were categorized");
            return;
        }

        cli.println(Streams.concat(
                Stream.of(String.format("%d transactions could not be categorized:", unresolved.size()),
                        "DATE" + CSV_DELIMITER + "TRANSACTION TYPE" + CSV_DELIMITER + "DESCRIPTION"),
                unresolved.stream()
                        .map(t -> t.getFormattedDate() + CSV_DELIMITER + StringUtils.defaultString(t.getType()) + CSV_DELIMITER + t.getDescription())
        ).collect(Collectors.toList()));
    }

    /**
     * Groups transactions by category, sorted by descending count. Categories with the same count are sorted by name.
     */
    public List<CategoryStatistics> getCategoryStatistics(List<CategorizedTransaction> transactions) {
        final Map<String, List<CategorizedTransaction>> byCategory = transactions.stream()
                .collect(Collectors.groupingBy(CategorizedTransaction::getCategory, LinkedHashMap::new, Collectors.toList()));

        return byCategory.entrySet().stream()
                .map(entry -> new CategoryStatistics(
                        entry.getKey(),
                        entry.getValue().size(),
                        entry.getValue().stream()
                                .map(Transaction::getAmount)
                                .reduce(BigDecimal.ZERO, BigDecimal::add)))
                .sorted(Comparator.comparingLong(CategoryStatistics::count).reversed()
                        .thenComparing(CategoryStatistics::category))
                .toList();
    }

    /**
     * Returns the transactions whose category or payment label is Unknown, sorted by date descending. Transactions
     * with an unparseable date come last.
     */
    public List<CategorizedTransaction> findUnresolvedTransactions(List<CategorizedTransaction> transactions) {
        return transactions.stream()
                .filter(CategorizedTransaction::isUnresolved)
                .sorted(Comparator.comparing(Transaction::getDate, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder())))
                .toList();
    }

    public record CategoryStatistics(String category, long count, BigDecimal totalAmount) { }
}
