package ca.jonathanfritz.bankcat.io;

import ca.jonathanfritz.bankcat.TestUtils;
import ca.jonathanfritz.bankcat.exception.MalformedSourceException;
import ca.jonathanfritz.bankcat.transactions.Account;
import ca.jonathanfritz.bankcat.transactions.Transaction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.comparesEqualTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;

class FnbStatementParserTest {

    private static final String ACCOUNT_ROW = "2,62812345678, 'Cheque Account'";

    private final FnbStatementParser parser = new FnbStatementParser();

    @TempDir
    Path tempDir;

    @Test
    void parseStatementTest() throws MalformedSourceException {
        final List<Transaction> transactions = parser.parse(TestUtils.getResourcePath("/input/FNB/january.csv"));
        assertThat(transactions, hasSize(4));

        final Transaction first = transactions.get(0);
        assertThat(first.getDate(), equalTo(LocalDate.of(2023, 1, 5)));
        assertThat(first.getFormattedDate(), equalTo("2023/01/05"));
        assertThat(first.getDescription(), equalTo("WOOLWORTHS SANDTON"));
        assertThat(first.getAmount(), comparesEqualTo(new BigDecimal("-150.00")));
        assertThat(first.getType(), equalTo(FnbStatementParser.FNB_GENERIC));
        assertThat(first.getAccount(), equalTo(TestUtils.TEST_ACCOUNT));

        // the balance column has no canonical counterpart, but it is kept
        assertThat(first.getExtraColumns(), hasEntry("Balance", "9850.00"));
    }

    @Test
    void feeDetectionTest() throws IOException, MalformedSourceException {
        // Setup: a fee row and an ordinary row
        final Path file = TestUtils.writeLines(tempDir, "fees.csv",
                "0,\"ACCOUNT TRANSACTION HISTORY\"",
                "1,\"2023/01/01\",\"2023/01/31\"",
                "1,\"Statement Period\"",
                ACCOUNT_ROW,
                "Date, Amount, Balance, Description",
                "2023/01/06,-5.00,9845.00,  #Monthly Fee 5.00  ",
                "2023/01/07,-12.00,9833.00,Coffee #2");

        // Execute:
        final List<Transaction> transactions = parser.parse(file);

        // Verify: only descriptions that start with # are fees, and descriptions are stripped
        assertThat(transactions, hasSize(2));
        assertThat(transactions.get(0).getDescription(), equalTo("#Monthly Fee 5.00"));
        assertThat(transactions.get(0).getType(), equalTo(FnbStatementParser.FEE));
        assertThat(transactions.get(1).getType(), equalTo(FnbStatementParser.FNB_GENERIC));
    }

    @Test
    void tooFewLinesTest() throws IOException {
        final Path file = TestUtils.writeLines(tempDir, "short.csv",
                "0,\"ACCOUNT TRANSACTION HISTORY\"",
                "1,\"2023/01/01\",\"2023/01/31\"");

        final MalformedSourceException ex = Assertions.assertThrows(MalformedSourceException.class, () -> parser.parse(file));
        assertThat(ex.getPath(), equalTo(file));
    }

    @Test
    void missingHeaderTest() throws IOException {
        // the four metadata lines are present, but nothing follows them
        final Path file = TestUtils.writeLines(tempDir, "metadata-only.csv",
                "0,\"ACCOUNT TRANSACTION HISTORY\"",
                "1,\"2023/01/01\",\"2023/01/31\"",
                "1,\"Statement Period\"",
                ACCOUNT_ROW);

        final MalformedSourceException ex = Assertions.assertThrows(MalformedSourceException.class, () -> parser.parse(file));
        assertThat(ex.getMessage(), containsString("Missing header row"));
    }

    @Test
    void unparseableDateTest() throws IOException, MalformedSourceException {
        final Path file = TestUtils.writeLines(tempDir, "bad-date.csv",
                "0,\"ACCOUNT TRANSACTION HISTORY\"",
                "1,\"2023/01/01\",\"2023/01/31\"",
                "1,\"Statement Period\"",
                ACCOUNT_ROW,
                "Date, Amount, Balance, Description",
                "sometime,-5.00,9845.00,Coffee");

        final Transaction transaction = parser.parse(file).get(0);

        // the transaction survives with a marker in place of its date
        assertThat(transaction.getDate(), nullValue());
        assertThat(transaction.getRawDate(), equalTo("sometime"));
        assertThat(transaction.getFormattedDate(), equalTo(Transaction.UNPARSEABLE_DATE));
    }

    @Test
    void nonNumericAmountTest() throws IOException {
        final Path file = TestUtils.writeLines(tempDir, "bad-amount.csv",
                "0,\"ACCOUNT TRANSACTION HISTORY\"",
                "1,\"2023/01/01\",\"2023/01/31\"",
                "1,\"Statement Period\"",
                ACCOUNT_ROW,
                "Date, Amount, Balance, Description",
                "2023/01/06,five rand,9845.00,Coffee");

        Assertions.assertThrows(MalformedSourceException.class, () -> parser.parse(file));
    }

    @Test
    void parseAccountTest() throws MalformedSourceException {
        final Account account = parser.parseAccount(tempDir, ACCOUNT_ROW);
        assertThat(account.getAccountNumber(), equalTo("62812345678"));
        assertThat(account.getName(), equalTo("Cheque Account"));
    }

    @Test
    void parseAccountTooFewFieldsTest() {
        Assertions.assertThrows(MalformedSourceException.class, () -> parser.parseAccount(tempDir, "2,62812345678"));
    }
}
