package ca.jonathanfritz.bankcat.matching;

import ca.jonathanfritz.bankcat.config.RuleSchema;
import ca.jonathanfritz.bankcat.exception.RuleTableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a rule table from a JSON file. Unlike most configuration, a rule table that is missing or broken is fatal,
 * since no transaction can be categorized without it.
 */
public class RuleTableLoader {

    private static final Logger logger = LogManager.getLogger(RuleTableLoader.class);

    private final ObjectMapper jsonMapper = new ObjectMapper();

    /**
     * Loads the rule table at the specified path
     *
     * @param path   the path to the JSON rule table
     * @param schema the layout that the rule table is expected to have
     * @throws RuleTableException if the file does not exist, is not valid JSON, or does not have the expected layout
     */
    public RuleTable load(Path path, RuleSchema schema) throws RuleTableException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new RuleTableException(String.format("Rule table %s does not exist", path));
        }

        try (InputStream is = Files.newInputStream(path)) {
            final RuleTable ruleTable = parse(jsonMapper.readTree(is), schema);
            logger.info("Loaded {} rule table with {} match strings from {}", schema.toConfigValue(), ruleTable.size(), path);
            return ruleTable;
        } catch (IOException e) {
            throw new RuleTableException(String.format("Failed to read rule table %s", path), e);
        }
    }

    /**
     * Loads a rule table from a JSON string.
     * Useful for testing.
     */
    public RuleTable loadFromString(String json, RuleSchema schema) throws RuleTableException {
        if (json == null || json.isBlank()) {
            throw new RuleTableException("Rule table is empty");
        }

        try {
            return parse(jsonMapper.readTree(json), schema);
        } catch (IOException e) {
            throw new RuleTableException("Failed to parse rule table", e);
        }
    }

    private RuleTable parse(JsonNode root, RuleSchema schema) throws RuleTableException {
        if (root == null || !root.isObject()) {
            throw new RuleTableException("Rule table must be a JSON object");
        }

        final JsonNode rules = root.get(schema.getRootKey());
        requireObject(rules, schema.getRootKey());

        return switch (schema) {
            case TRANSACTION_MAP -> parseTransactionMap(rules);
            case CATEGORY_MAPPING -> parseCategoryMapping(rules);
        };
    }

    private TransactionMapRuleTable parseTransactionMap(JsonNode transactionMap) throws RuleTableException {
        final Map<String, Map<String, Map<String, List<String>>>> types = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> type : transactionMap.properties()) {
            requireObject(type.getValue(), type.getKey());

            final Map<String, Map<String, List<String>>> categories = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> category : type.getValue().properties()) {
                final String categoryPath = type.getKey() + " > " + category.getKey();
                requireObject(category.getValue(), categoryPath);

                final Map<String, List<String>> labels = new LinkedHashMap<>();
                for (Map.Entry<String, JsonNode> label : category.getValue().properties()) {
                    labels.put(label.getKey(), toMatchStrings(label.getValue(), categoryPath + " > " + label.getKey()));
                }
                categories.put(category.getKey(), labels);
            }
            types.put(type.getKey(), categories);
        }
        return new TransactionMapRuleTable(types);
    }

    private CategoryMappingRuleTable parseCategoryMapping(JsonNode categoryMapping) throws RuleTableException {
        final List<CategoryMappingRuleTable.Rule> rules = new ArrayList<>();
        for (Map.Entry<String, JsonNode> type : categoryMapping.properties()) {
            requireObject(type.getValue(), type.getKey());

            for (Map.Entry<String, JsonNode> mapping : type.getValue().properties()) {
                if (!mapping.getValue().isTextual()) {
                    throw new RuleTableException(String.format("Category for '%s > %s' must be a string", type.getKey(), mapping.getKey()));
                }
                rules.add(new CategoryMappingRuleTable.Rule(type.getKey(), mapping.getKey(), mapping.getValue().asText()));
            }
        }
        return new CategoryMappingRuleTable(rules);
    }

    private List<String> toMatchStrings(JsonNode node, String path) throws RuleTableException {
        if (node == null || !node.isArray()) {
            throw new RuleTableException(String.format("'%s' must be a list of match strings", path));
        }

        final List<String> matchStrings = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new RuleTableException(String.format("'%s' contains %s, which is not a string", path, element));
            }
            matchStrings.add(element.asText());
        }
        return matchStrings;
    }

    private static void requireObject(JsonNode node, String path) throws RuleTableException {
        if (node == null || !node.isObject()) {
            throw new RuleTableException(String.format("'%s' must be a JSON object", path));
        }
    }
}
