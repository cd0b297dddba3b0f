package ca.jonathanfritz.bankcat.service;

import ca.jonathanfritz.bankcat.config.AppConfig;
import ca.jonathanfritz.bankcat.exception.MalformedSourceException;
import ca.jonathanfritz.bankcat.io.SourceDialect;
import ca.jonathanfritz.bankcat.io.StatementParser;
import ca.jonathanfritz.bankcat.io.StatementParserFactory;
import ca.jonathanfritz.bankcat.transactions.Transaction;
import com.google.inject.Inject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads every statement in the input directory and merges the results into one de-duplicated list of transactions
 */
public class StatementImportService {

    private static final Logger logger = LogManager.getLogger(StatementImportService.class);

    private final StatementParserFactory statementParserFactory;
    private final AppConfig appConfig;

    @Inject
    public StatementImportService(StatementParserFactory statementParserFactory, AppConfig appConfig) {
        this.statementParserFactory = statementParserFactory;
        this.appConfig = appConfig;
    }

    /**
     * Imports the folder of every {@link SourceDialect} under the input directory, then merges them in dialect order
     */
    public List<Transaction> importAll(Path inputDirectory) throws IOException {
        final List<List<Transaction>> sources = new ArrayList<>();
        for (SourceDialect dialect : SourceDialect.values()) {
            final Path folder = inputDirectory.resolve(statementParserFactory.getFolderName(dialect));
            sources.add(importFolder(statementParserFactory.findByDialect(dialect), folder));
        }

        final List<Transaction> merged = merge(sources);
        logger.info("Imported {} unique transactions from {}", merged.size(), inputDirectory);
        return merged;
    }

    /**
     * Parses every file in the folder that has the configured extension, in file name order. Identical transactions
     * are collapsed, keeping the first one seen. A file that cannot be parsed is logged and skipped.
     *
     * @return the transactions, or an empty list if the folder does not exist or holds no matching files
     * @throws IOException if the folder exists but cannot be listed
     */
    public List<Transaction> importFolder(StatementParser parser, Path folder) throws IOException {
        if (!Files.isDirectory(folder)) {
            logger.warn("{} statement folder {} does not exist", parser.getDialect(), folder);
            return List.of();
        }

        final List<Path> files;
        try (Stream<Path> listing = Files.list(folder)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(appConfig.getFileExtension()))
                    .sorted()
                    .toList();
        }

        final LinkedHashSet<Transaction> transactions = new LinkedHashSet<>();
        for (Path file : files) {
            try {
                transactions.addAll(parser.parse(file));
            } catch (MalformedSourceException ex) {
                logger.error("Skipping malformed {} statement {}", parser.getDialect(), ex.getPath(), ex);
            }
        }

        logger.info("Imported {} unique {} transactions from {} files in {}", transactions.size(), parser.getDialect(), files.size(), folder);
        return new ArrayList<>(transactions);
    }

    /**
     * Concatenates the collections in the order given and collapses identical transactions, keeping the first one seen
     */
    public List<Transaction> merge(List<? extends Collection<Transaction>> sources) {
        final LinkedHashSet<Transaction> merged = new LinkedHashSet<>();
        sources.forEach(merged::addAll);
        return new ArrayList<>(merged);
    }
}
