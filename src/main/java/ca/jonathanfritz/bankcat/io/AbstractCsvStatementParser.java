package ca.jonathanfritz.bankcat.io;

import ca.jonathanfritz.bankcat.exception.MalformedSourceException;
import ca.jonathanfritz.bankcat.transactions.Transaction;
import ca.jonathanfritz.bankcat.utils.DateParser;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared plumbing for the CSV based statement dialects. Subclasses decide how many lines to skip, where the column
 * names come from, and which fields are synthesized, then hand each row to {@link #newTransaction(Path, Row)}.
 */
public abstract class AbstractCsvStatementParser implements StatementParser {

    // canonical column names
    public static final String DATE = "Date";
    public static final String DESCRIPTION = "Description";
    public static final String AMOUNT = "Amount";
    public static final String TRANSACTION_TYPE = "Transaction Type";
    public static final String ACCOUNT_NUMBER = "Account Number";
    public static final String ACCOUNT_NAME = "Account Name";

    private static final Set<String> CANONICAL_COLUMNS = Set.of(DATE, DESCRIPTION, AMOUNT, TRANSACTION_TYPE, ACCOUNT_NUMBER, ACCOUNT_NAME);

    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .build();

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    protected final Logger logger = LogManager.getLogger(getClass());

    @Override
    public List<Transaction> parse(Path file) throws MalformedSourceException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            final List<Transaction> transactions = parse(file, reader);
            logger.debug("Parsed {} transactions from {}", transactions.size(), file);
            return transactions;
        } catch (IOException | UncheckedIOException ex) {
            throw new MalformedSourceException(file, "Failed to read statement file", ex);
        }
    }

    /**
     * Parses the open statement file. The reader is positioned at the first line.
     */
    protected abstract List<Transaction> parse(Path file, BufferedReader reader) throws IOException, MalformedSourceException;

    /**
     * Consumes the specified number of lines that precede the CSV content
     *
     * @return the skipped lines
     * @throws MalformedSourceException if the file ends first
     */
    protected List<String> skipLines(Path file, BufferedReader reader, int count) throws IOException, MalformedSourceException {
        final List<String> lines = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            final String line = reader.readLine();
            if (line == null) {
                throw new MalformedSourceException(file, String.format("Expected at least %d leading lines but found %d", count, i));
            }
            lines.add(line);
        }
        return lines;
    }

    /**
     * Reads all remaining records. Blank lines are ignored.
     */
    protected List<CSVRecord> readRecords(Reader reader) throws IOException {
        try (CSVParser parser = CSV_FORMAT.parse(reader)) {
            return parser.getRecords();
        }
    }

    /**
     * Reads a header record followed by data records. Column names are stripped of surrounding whitespace.
     *
     * @throws MalformedSourceException if there is no header record
     */
    protected List<Row> readRowsWithHeader(Path file, Reader reader) throws IOException, MalformedSourceException {
        final List<CSVRecord> records = readRecords(reader);
        if (records.isEmpty()) {
            throw new MalformedSourceException(file, "Missing header row");
        }

        final List<String> columnNames = records.get(0).stream()
                .map(name -> StringUtils.removeStart(name, BYTE_ORDER_MARK).strip())
                .toList();
        final List<Row> rows = new ArrayList<>();
        for (CSVRecord record : records.subList(1, records.size())) {
            rows.add(toRow(file, columnNames, record));
        }
        return rows;
    }

    /**
     * Pairs the fields of a record with column names by position. Short records simply lack the trailing columns.
     *
     * @throws MalformedSourceException if the record has more fields than there are column names
     */
    protected Row toRow(Path file, List<String> columnNames, CSVRecord record) throws MalformedSourceException {
        if (record.size() > columnNames.size()) {
            throw new MalformedSourceException(file, String.format("Record %d has %d fields but only %d columns are defined",
                    record.getRecordNumber(), record.size(), columnNames.size()));
        }

        final Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < record.size(); i++) {
            values.put(columnNames.get(i), record.get(i));
        }
        return new Row(record.getRecordNumber(), values);
    }

    /**
     * Starts a transaction from the canonical Date, Description and Amount columns of a row. Every other non-canonical
     * column is carried along as an extra column.
     *
     * @throws MalformedSourceException if a canonical column is missing or the amount is not a number
     */
    protected Transaction.Builder newTransaction(Path file, Row row) throws MalformedSourceException {
        final String rawDate = require(file, row, DATE);
        final String description = require(file, row, DESCRIPTION).strip();
        final BigDecimal amount = parseAmount(file, row, require(file, row, AMOUNT));

        final Transaction.Builder builder = Transaction.newBuilder()
                .setDate(parseDate(file, row, rawDate))
                .setRawDate(rawDate)
                .setDescription(description)
                .setAmount(amount);

        row.values().forEach((name, value) -> {
            if (!CANONICAL_COLUMNS.contains(name)) {
                builder.putExtraColumn(name, value);
            }
        });
        return builder;
    }

    /**
     * Returns the value of a column that every row must have
     */
    protected String require(Path file, Row row, String column) throws MalformedSourceException {
        final String value = row.values().get(column);
        if (value == null) {
            throw new MalformedSourceException(file, String.format("Record %d has no %s column", row.number(), column));
        }
        return value;
    }

    /**
     * Parses the date of a row. The default implementation accepts any known date format and returns null when the
     * value cannot be parsed, leaving the transaction with an unparseable date.
     */
    protected LocalDate parseDate(Path file, Row row, String value) throws MalformedSourceException {
        return DateParser.parse(value).orElseGet(() -> {
            logger.warn("Unparseable date '{}' in record {} of {}", value, row.number(), file);
            return null;
        });
    }

    private BigDecimal parseAmount(Path file, Row row, String value) throws MalformedSourceException {
        try {
            return new BigDecimal(value.strip());
        } catch (NumberFormatException ex) {
            throw new MalformedSourceException(file, String.format("Record %d has amount '%s', which is not a number", row.number(), value), ex);
        }
    }

    /**
     * One data record of a statement, keyed by column name
     *
     * @param number the 1-based number of the record among the records that were read
     */
    protected record Row(long number, Map<String, String> values) {}
}
