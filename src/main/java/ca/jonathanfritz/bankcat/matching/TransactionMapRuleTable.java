package ca.jonathanfritz.bankcat.matching;

import ca.jonathanfritz.bankcat.config.RuleSchema;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A rule table in the {@link RuleSchema#TRANSACTION_MAP} layout:
 * <pre>
 * transaction type -> category -> payment label -> [match strings]
 * </pre>
 * The {@link #PAYMENTS} transaction type holds the rules for card purchases. Every level keeps the order of the file.
 */
public class TransactionMapRuleTable implements RuleTable {

    public static final String PAYMENTS = "Payments";

    private final Map<String, Map<String, Map<String, List<String>>>> rules;

    public TransactionMapRuleTable(Map<String, Map<String, Map<String, List<String>>>> rules) {
        final ImmutableMap.Builder<String, Map<String, Map<String, List<String>>>> types = ImmutableMap.builder();
        rules.forEach((type, categories) -> {
            final ImmutableMap.Builder<String, Map<String, List<String>>> categoryBuilder = ImmutableMap.builder();
            categories.forEach((category, labels) -> {
                final ImmutableMap.Builder<String, List<String>> labelBuilder = ImmutableMap.builder();
                labels.forEach((label, matchStrings) -> labelBuilder.put(label, ImmutableList.copyOf(matchStrings)));
                categoryBuilder.put(category, labelBuilder.build());
            });
            types.put(type, categoryBuilder.build());
        });
        this.rules = types.build();
    }

    @Override
    public RuleSchema getSchema() {
        return RuleSchema.TRANSACTION_MAP;
    }

    @Override
    public int size() {
        return rules.values().stream()
                .flatMap(categories -> categories.values().stream())
                .flatMap(labels -> labels.values().stream())
                .mapToInt(List::size)
                .sum();
    }

    @Override
    public TransactionClassifier newClassifier() {
        return new TransactionMapClassifier(this);
    }

    /**
     * Returns the categories for card purchases, or an empty map if the table has no {@link #PAYMENTS} entry
     */
    public Map<String, Map<String, List<String>>> getPaymentRules() {
        return rules.getOrDefault(PAYMENTS, ImmutableMap.of());
    }

    /**
     * Returns the categories for the specified transaction type, if the table has an entry for it
     */
    public Optional<Map<String, Map<String, List<String>>>> getRulesForType(String transactionType) {
        return Optional.ofNullable(transactionType).map(rules::get);
    }

    public Map<String, Map<String, Map<String, List<String>>>> getRules() {
        return rules;
    }
}
