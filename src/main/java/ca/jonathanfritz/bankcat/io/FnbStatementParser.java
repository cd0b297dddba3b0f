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
 * Reads FNB statement exports. The first four lines are metadata, and the last of those names the account:
 * <pre>
 * 2,62812345678," 'Cheque Account'",...
 * </pre>
 * The fifth line holds the column names, and the transactions follow. FNB has no transaction type column, so every
 * transaction is typed {@link #FNB_GENERIC}, except for fees, whose description starts with {@link #FEE_MARKER}.
 */
public class FnbStatementParser extends AbstractCsvStatementParser {

    public static final String FNB_GENERIC = "FNB Generic";
    public static final String FEE = "Fee";
    static final String FEE_MARKER = "#";

    // the metadata row must agree with the header position: header on line 5, after 4 metadata lines
    static final int METADATA_LINES = 4;

    @Override
    public SourceDialect getDialect() {
        return SourceDialect.FNB;
    }

    @Override
    protected List<Transaction> parse(Path file, BufferedReader reader) throws IOException, MalformedSourceException {
        final List<String> metadata = skipLines(file, reader, METADATA_LINES);
        final Account account = parseAccount(file, metadata.get(METADATA_LINES - 1));

        final List<Transaction> transactions = new ArrayList<>();
        for (Row row : readRowsWithHeader(file, reader)) {
            final Transaction.Builder builder = newTransaction(file, row);
            final String description = require(file, row, DESCRIPTION).strip();
            transactions.add(builder
                    .setType(description.startsWith(FEE_MARKER) ? FEE : FNB_GENERIC)
                    .setAccount(account)
                    .build());
        }
        return transactions;
    }

    /**
     * The 2nd field of the account row is the account number. The 3rd is the account name, wrapped in two leading
     * characters and one trailing character that are not part of the name.
     */
    Account parseAccount(Path file, String accountRow) throws MalformedSourceException {
        final String[] fields = accountRow.strip().split(",", -1);
        if (fields.length < 3) {
            throw new MalformedSourceException(file, String.format("Account row '%s' has %d fields, expected at least 3", accountRow, fields.length));
        }

        final String wrappedName = fields[2];
        if (wrappedName.length() < 3) {
            throw new MalformedSourceException(file, String.format("Account name '%s' is too short to unwrap", wrappedName));
        }

        return Account.newBuilder()
                .setAccountNumber(fields[1])
                .setName(wrappedName.substring(2, wrappedName.length() - 1))
                .build();
    }
}
