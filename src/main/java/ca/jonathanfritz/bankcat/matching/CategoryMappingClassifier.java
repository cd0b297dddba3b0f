package ca.jonathanfritz.bankcat.matching;

import ca.jonathanfritz.bankcat.transactions.Transaction;

import java.util.Locale;

/**
 * Classifies transactions with a {@link CategoryMappingRuleTable}. The first rule whose transaction type applies and
 * whose match string occurs in the lower-cased description decides the category. No payment label is assigned.
 */
public class CategoryMappingClassifier implements TransactionClassifier {

    private final CategoryMappingRuleTable ruleTable;

    public CategoryMappingClassifier(CategoryMappingRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    @Override
    public Classification classify(Transaction transaction) {
        final String description = transaction.getDescription().toLowerCase(Locale.ROOT);
        return ruleTable.getRules().stream()
                .filter(rule -> rule.appliesTo(transaction.getType()))
                .filter(rule -> description.contains(rule.matchString()))
                .findFirst()
                .map(rule -> Classification.categoryOnly(rule.category()))
                .orElseGet(() -> Classification.categoryOnly(Classification.UNKNOWN));
    }

    @Override
    public boolean assignsPayment() {
        return false;
    }
}
