package ca.jonathanfritz.bankcat.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * The two rule table layouts that bankcat understands. They match transactions differently and are never combined.
 */
public enum RuleSchema {

    /**
     * {"Transaction Map": {type: {category: {payment label: [substrings]}}}}, assigns a category and a payment label
     */
    TRANSACTION_MAP("Transaction Map"),

    /**
     * {"category_mapping": {type: {substring: category}}}, assigns a category only
     */
    CATEGORY_MAPPING("category_mapping");

    private final String rootKey;

    RuleSchema(String rootKey) {
        this.rootKey = rootKey;
    }

    /**
     * The name of the top level JSON object that holds the rules
     */
    public String getRootKey() {
        return rootKey;
    }

    @JsonValue
    public String toConfigValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuleSchema fromConfigValue(String value) {
        return Arrays.stream(values())
                .filter(schema -> schema.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(String.format("Unknown rule schema %s", value)));
    }
}
