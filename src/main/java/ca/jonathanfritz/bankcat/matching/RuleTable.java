package ca.jonathanfritz.bankcat.matching;

import ca.jonathanfritz.bankcat.config.RuleSchema;

/**
 * An ordered set of categorization rules, read once per run from the user's rule table file.
 * Rules are evaluated in the order they appear in the file, and the first match wins.
 */
public interface RuleTable {

    RuleSchema getSchema();

    /**
     * Returns the total number of match strings in the table
     */
    int size();

    /**
     * Creates the classifier that implements this table's matching semantics
     */
    TransactionClassifier newClassifier();
}
