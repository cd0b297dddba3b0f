package ca.jonathanfritz.bankcat.io;

import ca.jonathanfritz.bankcat.exception.MalformedSourceException;
import ca.jonathanfritz.bankcat.transactions.Account;
import ca.jonathanfritz.bankcat.transactions.Transaction;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads Standard Bank statement exports. These start with three lines of preamble, have no header row, and end with a
 * trailer line that is not a transaction. Columns are identified by position, and dates are always yyyyMMdd.
 */
public class StandardBankStatementParser extends AbstractCsvStatementParser {

    static final int PREAMBLE_LINES = 3;

    static final List<String> COLUMN_NAMES = List.of("HIST", DATE, "#", AMOUNT, TRANSACTION_TYPE, DESCRIPTION, "Code", "0");

    // a record must reach the description column to be a transaction
    private static final int MINIMUM_FIELDS = COLUMN_NAMES.indexOf(DESCRIPTION) + 1;

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    private final Account account;

    public StandardBankStatementParser(Account account) {
        this.account = account;
    }

    @Override
    public SourceDialect getDialect() {
        return SourceDialect.STANDARD_BANK;
    }

    @Override
    protected List<Transaction> parse(Path file, BufferedReader reader) throws IOException, MalformedSourceException {
        skipLines(file, reader, PREAMBLE_LINES);

        final List<CSVRecord> records = readRecords(reader);
        if (records.isEmpty()) {
            throw new MalformedSourceException(file, "Missing trailer line");
        }

        // the last record is the trailer
        final List<Transaction> transactions = new ArrayList<>();
        for (CSVRecord record : records.subList(0, records.size() - 1)) {
            if (record.size() < MINIMUM_FIELDS) {
                throw new MalformedSourceException(file, String.format("Record %d has %d fields, expected at least %d",
                        record.getRecordNumber(), record.size(), MINIMUM_FIELDS));
            }

            final Row row = toRow(file, COLUMN_NAMES, record);
            transactions.add(newTransaction(file, row)
                    .setType(require(file, row, TRANSACTION_TYPE).strip())
                    .setAccount(account)
                    .build());
        }
        return transactions;
    }

    /**
     * Standard Bank dates must be yyyyMMdd. Anything else means the file is not what it claims to be.
     */
    @Override
    protected LocalDate parseDate(Path file, Row row, String value) throws MalformedSourceException {
        try {
            return LocalDate.parse(value.strip(), DATE_FORMATTER);
        } catch (DateTimeParseException ex) {
            throw new MalformedSourceException(file, String.format("Record %d has date '%s', expected yyyyMMdd", row.number(), value), ex);
        }
    }
}
