package ca.jonathanfritz.bankcat.matching;

import ca.jonathanfritz.bankcat.config.AppConfig;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Guice module for matching-related dependencies.
 * The rule table is loaded before the injector is created, so that a missing or broken table stops the run before any
 * statement is read.
 */
public class MatchingModule extends AbstractModule {

    private static final Logger logger = LogManager.getLogger(MatchingModule.class);

    private final AppConfig appConfig;
    private final RuleTable ruleTable;

    public MatchingModule(AppConfig appConfig, RuleTable ruleTable) {
        this.appConfig = appConfig;
        this.ruleTable = ruleTable;
    }

    @Provides
    @Singleton
    public AppConfig provideAppConfig() {
        return appConfig;
    }

    @Provides
    @Singleton
    public RuleTable provideRuleTable() {
        return ruleTable;
    }

    @Provides
    @Singleton
    public TransactionClassifier provideTransactionClassifier(RuleTable ruleTable) {
        final TransactionClassifier classifier = ruleTable.newClassifier();
        logger.info("Classifying transactions with {}", classifier.getClass().getSimpleName());
        return classifier;
    }
}
