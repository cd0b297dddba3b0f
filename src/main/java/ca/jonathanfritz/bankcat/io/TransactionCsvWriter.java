package ca.jonathanfritz.bankcat.io;

import ca.jonathanfritz.bankcat.transactions.CategorizedTransaction;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes categorized transactions to flat CSV files. Nothing is computed here, every value comes from the transactions.
 */
public class TransactionCsvWriter {

    static final String CATEGORY = "Category";
    static final String PAYMENT = "Payment";

    static final List<String> TRANSACTION_COLUMNS = List.of(
            AbstractCsvStatementParser.DATE,
            AbstractCsvStatementParser.ACCOUNT_NAME,
            AbstractCsvStatementParser.ACCOUNT_NUMBER,
            AbstractCsvStatementParser.TRANSACTION_TYPE,
            AbstractCsvStatementParser.DESCRIPTION,
            AbstractCsvStatementParser.AMOUNT,
            CATEGORY
    );

    static final List<String> BUDGET_COLUMNS = List.of(
            AbstractCsvStatementParser.DATE,
            AbstractCsvStatementParser.DESCRIPTION,
            AbstractCsvStatementParser.AMOUNT,
            CATEGORY,
            AbstractCsvStatementParser.ACCOUNT_NAME
    );

    private static final Logger logger = LogManager.getLogger(TransactionCsvWriter.class);

    /**
     * Writes every field of the categorized transactions
     *
     * @param includePayment whether to add the Payment column, which only some rule tables assign
     */
    public void writeTransactions(List<CategorizedTransaction> transactions, Path path, boolean includePayment) throws IOException {
        final List<String> columns = new ArrayList<>(TRANSACTION_COLUMNS);
        if (includePayment) {
            columns.add(PAYMENT);
        }

        try (CSVPrinter printer = open(path, columns)) {
            for (CategorizedTransaction t : transactions) {
                final List<Object> values = new ArrayList<>(List.of(
                        t.getFormattedDate(),
                        accountName(t),
                        t.getAccount() != null ? StringUtils.defaultString(t.getAccount().getAccountNumber()) : "",
                        StringUtils.defaultString(t.getType()),
                        t.getDescription(),
                        t.getAmount().toPlainString(),
                        t.getCategory()
                ));
                if (includePayment) {
                    values.add(t.getPayment().orElse(""));
                }
                printer.printRecord(values);
            }
        }
        logger.info("Wrote {} transactions to {}", transactions.size(), path);
    }

    /**
     * Writes the narrower projection that is pasted into the budget spreadsheet
     */
    public void writeBudget(List<CategorizedTransaction> transactions, Path path) throws IOException {
        try (CSVPrinter printer = open(path, BUDGET_COLUMNS)) {
            for (CategorizedTransaction t : transactions) {
                printer.printRecord(
                        t.getFormattedDate(),
                        t.getDescription(),
                        t.getAmount().toPlainString(),
                        t.getCategory(),
                        accountName(t));
            }
        }
        logger.info("Wrote {} budget lines to {}", transactions.size(), path);
    }

    private CSVPrinter open(Path path, List<String> columns) throws IOException {
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
        }

        final CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(columns.toArray(new String[0]))
                .build();
        final BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        try {
            // the header is written here, so the writer must not outlive a failure
            return new CSVPrinter(writer, format);
        } catch (IOException ex) {
            try {
                writer.close();
            } catch (IOException closeEx) {
                ex.addSuppressed(closeEx);
            }
            throw ex;
        }
    }

    private static String accountName(CategorizedTransaction t) {
        return t.getAccount() != null ? StringUtils.defaultString(t.getAccount().getName()) : "";
    }
}
