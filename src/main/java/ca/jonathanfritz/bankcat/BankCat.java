package ca.jonathanfritz.bankcat;

import ca.jonathanfritz.bankcat.cli.CLI;
import ca.jonathanfritz.bankcat.cli.CLIModule;
import ca.jonathanfritz.bankcat.config.AppConfig;
import ca.jonathanfritz.bankcat.config.AppConfigLoader;
import ca.jonathanfritz.bankcat.exception.BankCatException;
import ca.jonathanfritz.bankcat.exception.CliException;
import ca.jonathanfritz.bankcat.io.TransactionCsvWriter;
import ca.jonathanfritz.bankcat.matching.MatchingModule;
import ca.jonathanfritz.bankcat.matching.RuleTable;
import ca.jonathanfritz.bankcat.matching.RuleTableLoader;
import ca.jonathanfritz.bankcat.service.ReportingService;
import ca.jonathanfritz.bankcat.service.StatementImportService;
import ca.jonathanfritz.bankcat.service.TransactionCategoryService;
import ca.jonathanfritz.bankcat.transactions.CategorizedTransaction;
import ca.jonathanfritz.bankcat.transactions.Transaction;
import ca.jonathanfritz.bankcat.utils.PathUtils;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * The entrypoint to the application
 * Handles CLI argument parsing, configuration and rule table loading, and Guice injector setup
 */
public class BankCat {

    private static final Logger logger = LogManager.getLogger(BankCat.class);

    private final StatementImportService statementImportService;
    private final TransactionCategoryService transactionCategoryService;
    private final TransactionCsvWriter transactionCsvWriter;
    private final ReportingService reportingService;
    private final AppConfig appConfig;
    private final CLI cli;

    @Inject
    BankCat(StatementImportService statementImportService, TransactionCategoryService transactionCategoryService,
            TransactionCsvWriter transactionCsvWriter, ReportingService reportingService, AppConfig appConfig, CLI cli) {
        this.statementImportService = statementImportService;
        this.transactionCategoryService = transactionCategoryService;
        this.transactionCsvWriter = transactionCsvWriter;
        this.reportingService = reportingService;
        this.appConfig = appConfig;
        this.cli = cli;
    }

    /**
     * Imports every statement under the input directory, categorizes the transactions, writes the transactions and
     * budget files to the output directory, and prints the category and unresolved reports
     *
     * @return the categorized transactions, in the order they were written
     */
    List<CategorizedTransaction> categorize(Path inputDirectory, Path outputDirectory) throws BankCatException {
        logger.info("Categorizing statements in {}", inputDirectory);
        final List<CategorizedTransaction> categorized;
        try {
            final List<Transaction> transactions = statementImportService.importAll(inputDirectory);
            categorized = transactionCategoryService.categorize(transactions);
        } catch (IOException ex) {
            throw new BankCatException(String.format("Failed to read statements from %s", inputDirectory), ex);
        }

        final Path transactionsPath = outputDirectory.resolve(appConfig.getTransactionsFile());
        final Path budgetPath = outputDirectory.resolve(appConfig.getBudgetFile());
        try {
            transactionCsvWriter.writeTransactions(categorized, transactionsPath, transactionCategoryService.assignsPayment());
            transactionCsvWriter.writeBudget(categorized, budgetPath);
        } catch (IOException ex) {
            throw new BankCatException(String.format("Failed to write output files to %s", outputDirectory), ex);
        }

        reportingService.reportCategoryStatistics(categorized);
        reportingService.reportUnresolvedTransactions(categorized);
        cli.println(List.of(
                String.format("Wrote %d transactions to %s", categorized.size(), transactionsPath),
                String.format("Wrote budget to %s", budgetPath)
        ));
        return categorized;
    }

    private static void printHelp(CLI cli) {
        cli.println(Arrays.asList(
                "bankcat categorize [OPTIONS]",
                "   Reads the bank statements in the input directory, categorizes every transaction,",
                "   and writes Transactions.csv and Budget.csv to the output directory",
                "   --input-dir: Optional. Directory that holds the FNB, Discovery, Standard Bank and Cash folders",
                "                Defaults to the input_directory setting in config.yaml",
                "   --output-dir: Optional. Directory that the output files are written to",
                "   --rules: Optional. Path to the JSON rule table",
                "            Defaults to mappings.json in the input directory",
                "   --config-dir: Optional. Directory that holds config.yaml",
                "                 Defaults to ~/.bankcat",
                "bankcat help",
                "   Displays this help text"
        ));
    }

    public static void main(String[] args) throws BankCatException {
        try {
            // figure out which of the major modes we're in
            switch (getMode(args)) {
                case CATEGORIZE:
                    final BankCatOptions options = getOptions(args);
                    final Injector injector = initializeApplication(options);
                    injector.getInstance(BankCat.class).categorize(options.inputDirectory(), options.outputDirectory());
                    break;
                case HELP:
                    printHelp(Guice.createInjector(new CLIModule()).getInstance(CLI.class));
                    break;
            }
        } catch (CliException ex) {
            printHelp(Guice.createInjector(new CLIModule()).getInstance(CLI.class));
            throw ex;
        }
    }

    /**
     * Loads the rule table and creates the injector. The rule table is loaded first so that a missing or broken table
     * stops the run before any statement is read.
     */
    private static Injector initializeApplication(BankCatOptions options) throws BankCatException {
        final RuleTable ruleTable = new RuleTableLoader().load(options.rulesPath(), options.appConfig().getRuleSchema());
        return Guice.createInjector(new CLIModule(), new MatchingModule(options.appConfig(), ruleTable));
    }

    static Mode getMode(String[] args) throws CliException {
        if (args.length == 0) {
            throw new CliException("Too few arguments specified");
        }
        return Arrays.stream(Mode.values())
                .filter(m -> m.name().equalsIgnoreCase(args[0]))
                .findFirst()
                .orElseThrow(() -> new CliException(String.format("Invalid mode %s specified", args[0])));
    }

    enum Mode {
        CATEGORIZE,
        HELP
    }

    /**
     * Parses the options that follow the mode and loads config.yaml from the config directory. Options that are not
     * specified fall back to their config.yaml settings.
     */
    static BankCatOptions getOptions(String[] args) throws CliException {
        final Options options = new Options();
        options.addOption(Option.builder()
                .argName("i")
                .longOpt("input-dir")
                .desc("Directory that holds one folder per statement source")
                .hasArg(true)
                .required(false)
                .build());
        options.addOption(Option.builder()
                .argName("o")
                .longOpt("output-dir")
                .desc("Directory that the output files are written to")
                .hasArg(true)
                .required(false)
                .build());
        options.addOption(Option.builder()
                .argName("r")
                .longOpt("rules")
                .desc("Path to the JSON rule table")
                .hasArg(true)
                .required(false)
                .build());
        options.addOption(Option.builder()
                .argName("c")
                .longOpt("config-dir")
                .desc("Directory that holds config.yaml")
                .hasArg(true)
                .required(false)
                .build());

        final CommandLine commandLine;
        try {
            final CommandLineParser commandLineParser = new DefaultParser();
            commandLine = commandLineParser.parse(options, Arrays.copyOfRange(args, 1, args.length));
        } catch (ParseException e) {
            throw new CliException("Failed to parse options", e);
        }
        if (!commandLine.getArgList().isEmpty()) {
            throw new CliException(String.format("Unexpected arguments %s", commandLine.getArgList()));
        }

        final PathUtils pathUtils = new PathUtils();
        final Path configDirectory = commandLine.hasOption("config-dir")
                ? pathUtils.expand(commandLine.getOptionValue("config-dir"))
                : pathUtils.getConfigPath();
        final AppConfig appConfig = new AppConfigLoader().loadOrCreate(configDirectory).config();

        final Path inputDirectory = pathUtils.expand(commandLine.getOptionValue("input-dir", appConfig.getInputDirectory()));
        final Path outputDirectory = pathUtils.expand(commandLine.getOptionValue("output-dir", appConfig.getOutputDirectory()));
        final Path rulesPath = commandLine.hasOption("rules")
                ? pathUtils.expand(commandLine.getOptionValue("rules"))
                : pathUtils.resolve(inputDirectory, appConfig.getRulesPath());
        return new BankCatOptions(appConfig, inputDirectory, outputDirectory, rulesPath);
    }

    record BankCatOptions(AppConfig appConfig, Path inputDirectory, Path outputDirectory, Path rulesPath) { }
}
