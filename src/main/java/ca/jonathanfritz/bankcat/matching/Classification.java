package ca.jonathanfritz.bankcat.matching;

import ca.jonathanfritz.bankcat.transactions.CategorizedTransaction;

/**
 * The outcome of matching one transaction against the rule table
 *
 * @param category the assigned category, never null
 * @param payment  the assigned payment label, or null if the rule table does not assign one
 */
public record Classification(String category, String payment) {

    public static final String UNKNOWN = CategorizedTransaction.UNKNOWN;

    /**
     * No rule matched, and the rule table assigns payment labels
     */
    public static Classification unknown() {
        return new Classification(UNKNOWN, UNKNOWN);
    }

    /**
     * Only a category is assigned
     */
    public static Classification categoryOnly(String category) {
        return new Classification(category, null);
    }
}
