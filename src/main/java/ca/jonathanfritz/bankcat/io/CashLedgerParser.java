package ca.jonathanfritz.bankcat.io;

import ca.jonathanfritz.bankcat.exception.MalformedSourceException;
import ca.jonathanfritz.bankcat.transactions.Account;
import ca.jonathanfritz.bankcat.transactions.Transaction;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a hand-kept cash ledger with a header row and Date, Description and Amount columns
 */
public class CashLedgerParser extends AbstractCsvStatementParser {

    public static final String CASH = "Cash";

    private final Account account;

    public CashLedgerParser(Account account) {
        this.account = account;
    }

    @Override
    public SourceDialect getDialect() {
        return SourceDialect.CASH;
    }

    @Override
    protected List<Transaction> parse(Path file, BufferedReader reader) throws IOException, MalformedSourceException {
        final List<Transaction> transactions = new ArrayList<>();
        for (Row row : readRowsWithHeader(file, reader)) {
            transactions.add(newTransaction(file, row)
                    .setType(CASH)
                    .setAccount(account)
                    .build());
        }
        return transactions;
    }
}
