package ca.jonathanfritz.bankcat.matching;

import ca.jonathanfritz.bankcat.transactions.Transaction;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies transactions with a {@link TransactionMapRuleTable}. Rules are tried in this order, and the first one that
 * produces a result wins:
 * <ol>
 *     <li>Card purchases ({@link #GENERIC_PAYMENT_TYPES}) are matched against the {@link TransactionMapRuleTable#PAYMENTS}
 *     rules only, and resolve to (category, payment label).</li>
 *     <li>Other types that have an entry in the table are matched against that entry. {@link #TRANSFER} resolves to
 *     (Transfer, Transfer) as soon as its entry has a payment label, and {@link #EFT} resolves to (category, description) as described in
 *     {@link #classifyEft(Map, String, String)}. Every other type resolves to (category, payment label).</li>
 *     <li>Anything else is (Unknown, Unknown).</li>
 * </ol>
 * A match string matches when its trimmed, lower-cased form occurs anywhere in the trimmed, lower-cased description.
 */
public class TransactionMapClassifier implements TransactionClassifier {

    public static final Set<String> GENERIC_PAYMENT_TYPES = Set.of("Apple Pay", "POS Purchase", "FNB Generic");

    public static final String TRANSFER = "Transfer";
    public static final String EFT = "EFT";
    public static final String UNCATEGORISED = "Uncategorised";

    private final TransactionMapRuleTable ruleTable;

    public TransactionMapClassifier(TransactionMapRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    @Override
    public Classification classify(Transaction transaction) {
        final String type = transaction.getType();
        final String description = transaction.getDescription();
        final String normalizedDescription = normalize(description);

        if (type != null && GENERIC_PAYMENT_TYPES.contains(type)) {
            return findPaymentLabel(ruleTable.getPaymentRules(), normalizedDescription)
                    .orElseGet(Classification::unknown);
        }

        final Optional<Map<String, Map<String, List<String>>>> categories = ruleTable.getRulesForType(type);
        if (categories.isEmpty()) {
            return Classification.unknown();
        }

        if (TRANSFER.equals(type)) {
            return classifyTransfer(categories.get());
        } else if (EFT.equals(type)) {
            return classifyEft(categories.get(), normalizedDescription, description);
        }
        return findPaymentLabel(categories.get(), normalizedDescription)
                .orElseGet(Classification::unknown);
    }

    @Override
    public boolean assignsPayment() {
        return true;
    }

    /**
     * Searches every category, payment label and match string in table order
     */
    private Optional<Classification> findPaymentLabel(Map<String, Map<String, List<String>>> categories, String normalizedDescription) {
        for (Map.Entry<String, Map<String, List<String>>> category : categories.entrySet()) {
            for (Map.Entry<String, List<String>> label : category.getValue().entrySet()) {
                for (String matchString : label.getValue()) {
                    if (normalizedDescription.contains(normalize(matchString))) {
                        return Optional.of(new Classification(category.getKey(), label.getKey()));
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Transfers resolve to (Transfer, Transfer) without looking at the description, but only once the table defines at
     * least one payment label for them
     */
    private Classification classifyTransfer(Map<String, Map<String, List<String>>> categories) {
        for (Map<String, List<String>> labels : categories.values()) {
            if (!labels.isEmpty()) {
                return new Classification(TRANSFER, TRANSFER);
            }
        }
        return Classification.unknown();
    }

    /**
     * EFT transactions keep their own description as the payment label. Only the first match string in the table is
     * ever checked: if it matches, the transaction gets that string's category, and if it does not, the transaction is
     * {@link #UNCATEGORISED}. The remaining match strings are never consulted.
     * <p>
     * This looks like an accident, but rule tables written against it depend on it, so it stays literal.
     * Do not turn it into an exhaustive search without checking with the rule table owners.
     */
    private Classification classifyEft(Map<String, Map<String, List<String>>> categories, String normalizedDescription, String description) {
        for (Map.Entry<String, Map<String, List<String>>> category : categories.entrySet()) {
            for (List<String> matchStrings : category.getValue().values()) {
                for (String matchString : matchStrings) {
                    if (normalizedDescription.contains(normalize(matchString))) {
                        return new Classification(category.getKey(), description);
                    }
                    return new Classification(UNCATEGORISED, description);
                }
            }
        }
        return Classification.unknown();
    }

    private static String normalize(String value) {
        return value.strip().toLowerCase(Locale.ROOT);
    }
}
