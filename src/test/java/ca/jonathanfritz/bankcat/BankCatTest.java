package ca.jonathanfritz.bankcat;

import ca.jonathanfritz.bankcat.cli.CLI;
import ca.jonathanfritz.bankcat.config.AppConfig;
import ca.jonathanfritz.bankcat.config.RuleSchema;
import ca.jonathanfritz.bankcat.exception.RuleTableException;
import ca.jonathanfritz.bankcat.io.StatementParserFactory;
import ca.jonathanfritz.bankcat.io.TransactionCsvWriter;
import ca.jonathanfritz.bankcat.matching.RuleTableLoader;
import ca.jonathanfritz.bankcat.service.ReportingService;
import ca.jonathanfritz.bankcat.service.StatementImportService;
import ca.jonathanfritz.bankcat.service.TransactionCategoryService;
import ca.jonathanfritz.bankcat.transactions.CategorizedTransaction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;

class BankCatTest {

    @TempDir
    Path tempDir;

    @Test
    void categorizeTest() throws Exception {
        // Setup: wire the application by hand around the fixture statements, capturing console output
        final Path input = TestUtils.getResourcePath("/input");
        final AppConfig appConfig = AppConfig.defaults();
        final SpyCli spyCli = new SpyCli();
        final TransactionCategoryService transactionCategoryService = new TransactionCategoryService(
                new RuleTableLoader().load(input.resolve("mappings.json"), RuleSchema.TRANSACTION_MAP).newClassifier());
        final BankCat bankCat = new BankCat(
                new StatementImportService(new StatementParserFactory(appConfig), appConfig),
                transactionCategoryService,
                new TransactionCsvWriter(),
                new ReportingService(spyCli),
                appConfig,
                spyCli);

        // Execute:
        final List<CategorizedTransaction> categorized = bankCat.categorize(input, tempDir);

        // Verify: every transaction from every source is categorized
        assertThat(categorized, hasSize(11));
        assertThat(categorized.stream().map(t -> t.getCategory() + "/" + t.getPayment().orElse("")).toList(), contains(
                "Groceries/Woolworths",
                "Bank Charges/Monthly Fee",
                "Fuel/Engen",
                "Unknown/Unknown",
                "Entertainment/Netflix",
                "Transfer/Transfer",
                "Housing/Monthly rent payment",
                "Groceries/Checkers",
                "Bank Charges/Service Fee",
                "Parking/Car Guard",
                "Unknown/Unknown"
        ));

        // Verify: both output files were written
        final List<String> transactionLines = Files.readAllLines(tempDir.resolve("Transactions.csv"));
        assertThat(transactionLines, hasSize(12));
        assertThat(transactionLines.get(0), equalTo("Date,Account Name,Account Number,Transaction Type,Description,Amount,Category,Payment"));
        assertThat(transactionLines.get(7), equalTo("2023/01/09,Discovery Credit Card,17275813806,EFT,Monthly rent payment,-8500.00,Housing,Monthly rent payment"));

        final List<String> budgetLines = Files.readAllLines(tempDir.resolve("Budget.csv"));
        assertThat(budgetLines, hasSize(12));
        assertThat(budgetLines.get(1), equalTo("2023/01/05,WOOLWORTHS SANDTON,-150.00,Groceries,Cheque Account"));
        assertThat(budgetLines.get(11), equalTo("2023/01/21,Street vendor,-35.00,Unknown,Cash Transactions"));

        // Verify: the reports were printed
        assertThat(spyCli.getCapturedLines(), hasItem("Groceries" + ReportingService.CSV_DELIMITER + "2" + ReportingService.CSV_DELIMITER + "-400.00"));
        assertThat(spyCli.getCapturedLines(), hasItem("2 transactions could not be categorized:"));
    }

    @Test
    void categorizeIsIdempotentTest() throws Exception {
        // Setup: the same statement saved twice in one folder
        final Path input = tempDir.resolve("input");
        TestUtils.writeLines(input.resolve("Cash"), "a.csv", "Date,Description,Amount", "2023/01/20,Car guard,-10.00");
        TestUtils.writeLines(input.resolve("Cash"), "b.csv", "Date,Description,Amount", "2023/01/20,Car guard,-10.00");

        final AppConfig appConfig = AppConfig.defaults();
        final SpyCli spyCli = new SpyCli();
        final BankCat bankCat = new BankCat(
                new StatementImportService(new StatementParserFactory(appConfig), appConfig),
                new TransactionCategoryService(new RuleTableLoader().loadFromString("""
                        {"category_mapping": {"Cash": {"car guard": "Parking"}}}
                        """, RuleSchema.CATEGORY_MAPPING).newClassifier()),
                new TransactionCsvWriter(),
                new ReportingService(spyCli),
                appConfig,
                spyCli);

        // Execute:
        bankCat.categorize(input, tempDir.resolve("output"));

        // Verify: one transaction, and no payment column for a category mapping
        assertThat(Files.readAllLines(tempDir.resolve("output").resolve("Transactions.csv")), contains(
                "Date,Account Name,Account Number,Transaction Type,Description,Amount,Category",
                "2023/01/20,Cash Transactions,Cash Account,Cash,Car guard,-10.00,Parking"
        ));
        assertThat(spyCli.getCapturedLines(), hasItem("All transactions were categorized"));
    }

    @Test
    void missingRuleTableIsFatalTest() throws IOException {
        // Setup: a statement is waiting, but there is no rule table
        final Path input = tempDir.resolve("input");
        final Path output = tempDir.resolve("output");
        TestUtils.writeLines(input.resolve("Cash"), "ledger.csv", "Date,Description,Amount", "2023/01/20,Car guard,-10.00");

        // Execute:
        Assertions.assertThrows(RuleTableException.class, () -> BankCat.main(new String[]{
                "categorize",
                "--config-dir", tempDir.resolve("config").toString(),
                "--input-dir", input.toString(),
                "--output-dir", output.toString()
        }));

        // Verify: nothing was written
        Assertions.assertFalse(Files.exists(output));
    }

    private static class SpyCli extends CLI {

        private final List<String> capturedLines = new ArrayList<>();

        public SpyCli() {
            super(null);
        }

        @Override
        public void println(String line) {
            capturedLines.add(line);
        }

        @Override
        public void println(List<String> lines) {
            capturedLines.addAll(lines);
        }

        public List<String> getCapturedLines() {
            return Collections.unmodifiableList(capturedLines);
        }
    }
}
