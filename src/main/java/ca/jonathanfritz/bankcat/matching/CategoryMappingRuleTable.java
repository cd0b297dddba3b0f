package ca.jonathanfritz.bankcat.matching;

import ca.jonathanfritz.bankcat.config.RuleSchema;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A rule table in the {@link RuleSchema#CATEGORY_MAPPING} layout:
 * <pre>
 * transaction type -> match string -> category
 * </pre>
 * flattened into a list of rules in file order. A rule with an empty transaction type applies to every type.
 */
public class CategoryMappingRuleTable implements RuleTable {

    private final List<Rule> rules;

    public CategoryMappingRuleTable(List<Rule> rules) {
        this.rules = ImmutableList.copyOf(rules);
    }

    @Override
    public RuleSchema getSchema() {
        return RuleSchema.CATEGORY_MAPPING;
    }

    @Override
    public int size() {
        return rules.size();
    }

    @Override
    public TransactionClassifier newClassifier() {
        return new CategoryMappingClassifier(this);
    }

    public List<Rule> getRules() {
        return rules;
    }

    /**
     * @param transactionType the type that the rule applies to, or the empty string for any type
     * @param matchString     matched against the lower-cased description exactly as written
     * @param category        assigned when the rule matches
     */
    public record Rule(String transactionType, String matchString, String category) {

        public boolean appliesTo(String type) {
            return transactionType.isEmpty() || transactionType.equals(type);
        }
    }
}
