package ca.jonathanfritz.bankcat.io;

import ca.jonathanfritz.bankcat.exception.MalformedSourceException;
import ca.jonathanfritz.bankcat.transactions.Account;
import ca.jonathanfritz.bankcat.transactions.Transaction;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads Discovery credit card exports, which have a single header row. Discovery's column names are mapped onto the
 * canonical ones, and the value date, which may carry a time, is reduced to a date. Discovery exports do not identify
 * the account, so every transaction is stamped with the configured account.
 */
public class DiscoveryStatementParser extends AbstractCsvStatementParser {

    private static final Map<String, String> COLUMN_NAMES = Map.of(
            "Value Date", DATE,
            "Value Time", "Time",
            "Type", TRANSACTION_TYPE,
            "Description", DESCRIPTION,
            "Beneficiary or CardHolder", "Beneficiary/CardHolder",
            "Amount", AMOUNT
    );

    private final Account account;

    public DiscoveryStatementParser(Account account) {
        this.account = account;
    }

    @Override
    public SourceDialect getDialect() {
        return SourceDialect.DISCOVERY;
    }

    @Override
    protected List<Transaction> parse(Path file, BufferedReader reader) throws IOException, MalformedSourceException {
        final List<Transaction> transactions = new ArrayList<>();
        for (Row row : readRowsWithHeader(file, reader)) {
            final Row renamed = rename(row);
            transactions.add(newTransaction(file, renamed)
                    .setType(require(file, renamed, TRANSACTION_TYPE).strip())
                    .setAccount(account)
                    .build());
        }
        return transactions;
    }

    private Row rename(Row row) {
        final Map<String, String> values = new LinkedHashMap<>();
        row.values().forEach((name, value) -> values.put(COLUMN_NAMES.getOrDefault(name, name), value));
        return new Row(row.number(), values);
    }
}
