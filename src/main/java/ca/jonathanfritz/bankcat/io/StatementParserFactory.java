package ca.jonathanfritz.bankcat.io;

import ca.jonathanfritz.bankcat.config.AppConfig;
import ca.jonathanfritz.bankcat.transactions.Account;
import com.google.inject.Inject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;

/**
 * Holds one {@link StatementParser} per {@link SourceDialect}, along with the name of the folder that the dialect's
 * statements are read from. Parsers are chosen by the folder a file lives in, never by inspecting its contents.
 *
 * To add support for a new bank, add a {@link SourceDialect}, implement {@link StatementParser}, and register both here.
 *
 * @see StatementParser
 */
public class StatementParserFactory {

    private static final Logger logger = LogManager.getLogger(StatementParserFactory.class);

    private final Map<SourceDialect, StatementParser> parsers = new EnumMap<>(SourceDialect.class);
    private final Map<SourceDialect, String> folderNames = new EnumMap<>(SourceDialect.class);

    @Inject
    public StatementParserFactory(AppConfig appConfig) {
        final AppConfig.Sources sources = appConfig.getSources();
        register(new FnbStatementParser(), sources.getFnb());
        register(new DiscoveryStatementParser(toAccount(sources.getDiscovery())), sources.getDiscovery());
        register(new StandardBankStatementParser(toAccount(sources.getStandardBank())), sources.getStandardBank());
        register(new CashLedgerParser(toAccount(sources.getCash())), sources.getCash());
    }

    public StatementParser findByDialect(SourceDialect dialect) {
        final StatementParser parser = parsers.get(dialect);
        if (parser == null) {
            throw new IllegalArgumentException(String.format("No StatementParser is registered for %s", dialect));
        }
        return parser;
    }

    /**
     * Returns the name of the folder, relative to the input directory, that holds statements in the given dialect
     */
    public String getFolderName(SourceDialect dialect) {
        return folderNames.get(dialect);
    }

    private void register(StatementParser parser, AppConfig.SourceSettings settings) {
        parsers.put(parser.getDialect(), parser);
        folderNames.put(parser.getDialect(), settings.getFolder());
        logger.debug("Registered {} for {} statements in folder {}", parser.getClass().getSimpleName(), parser.getDialect(), settings.getFolder());
    }

    private static Account toAccount(AppConfig.SourceSettings settings) {
        return Account.newBuilder()
                .setAccountNumber(settings.getAccountNumber())
                .setName(settings.getAccountName())
                .build();
    }
}
