package com.itembank.tos.sufficiency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itembank.tos.sufficiency.SufficiencyModels.RequirementMatrix;
import com.itembank.tos.sufficiency.SufficiencyModels.RequirementTopic;
import com.itembank.tos.taxonomy.TaxonomyModels.CognitiveLevel;
import com.itembank.tos.text.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Reads the requirement matrix JSON produced by the TOS builder.
 * <p>
 * Two layouts are understood:
 * <pre>
 * { "topics": [ { "topic_name": "Algebra", "remembering_items": 5, "applying_items": 2 } ] }
 * { "matrix": { "Algebra": { "remembering": { "count": 5 }, "applying": 2 } } }
 * </pre>
 * The {@code topics} array wins when both are present.
 */
@Component
public class RequirementMatrixReader {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String ITEMS_SUFFIX = "_items";

    public RequirementMatrix read(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidRequirementMatrixException("Requirement matrix is empty");
        }
        try {
            return read(OBJECT_MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidRequirementMatrixException("Requirement matrix is not valid JSON: " + e.getOriginalMessage());
        }
    }

    public RequirementMatrix read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidRequirementMatrixException("Requirement matrix must be a JSON object");
        }
        JsonNode topics = root.get("topics");
        if (topics != null && topics.isArray()) {
            return readTopicRows(topics);
        }
        JsonNode matrix = root.get("matrix");
        if (matrix != null && matrix.isObject()) {
            return readNestedMatrix(matrix);
        }
        throw new InvalidRequirementMatrixException("Requirement matrix must contain a topics array");
    }

    private RequirementMatrix readTopicRows(JsonNode topics) {
        List<RequirementTopic> rows = new ArrayList<>();
        int index = 0;
        for (JsonNode row : topics) {
            if (!row.isObject()) {
                throw new InvalidRequirementMatrixException("topics[" + index + "] must be an object");
            }
            String name = text(row.get("topic_name"));
            if (name == null) name = text(row.get("topic"));
            if (name == null) {
                throw new InvalidRequirementMatrixException("topics[" + index + "] has no topic_name");
            }

            Map<CognitiveLevel, Integer> counts = new EnumMap<>(CognitiveLevel.class);
            Iterator<Map.Entry<String, JsonNode>> fields = row.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getKey().endsWith(ITEMS_SUFFIX)) continue;
                String prefix = field.getKey().substring(0, field.getKey().length() - ITEMS_SUFFIX.length());
                Optional<CognitiveLevel> level = CognitiveLevel.find(TextNormalizer.normalizeLabel(prefix));
                if (level.isPresent()) {
                    final String topicName = name;
                    counts.merge(level.get(), count(field.getValue(), topicName, prefix), (a, b) -> sum(a, b, topicName));
                }
            }
            rows.add(new RequirementTopic(name, counts));
            index++;
        }
        return new RequirementMatrix(rows);
    }

    private RequirementMatrix readNestedMatrix(JsonNode matrix) {
        List<RequirementTopic> rows = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> topics = matrix.fields();
        while (topics.hasNext()) {
            Map.Entry<String, JsonNode> topic = topics.next();
            if (!topic.getValue().isObject()) {
                throw new InvalidRequirementMatrixException("matrix." + topic.getKey() + " must be an object");
            }
            Map<CognitiveLevel, Integer> counts = new EnumMap<>(CognitiveLevel.class);
            Iterator<Map.Entry<String, JsonNode>> levels = topic.getValue().fields();
            while (levels.hasNext()) {
                Map.Entry<String, JsonNode> cell = levels.next();
                Optional<CognitiveLevel> level = CognitiveLevel.find(TextNormalizer.normalizeLabel(cell.getKey()));
                if (level.isEmpty()) continue;
                JsonNode value = cell.getValue().isObject() ? cell.getValue().get("count") : cell.getValue();
                counts.merge(level.get(), count(value, topic.getKey(), cell.getKey()), (a, b) -> sum(a, b, topic.getKey()));
            }
            rows.add(new RequirementTopic(topic.getKey(), counts));
        }
        return new RequirementMatrix(rows);
    }

    private int count(JsonNode value, String topic, String level) {
        if (value == null || value.isNull()) return 0;
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            int n = value.intValue();
            if (n >= 0) return n;
        } else if (value.isTextual() && value.asText().trim().matches("\\d{1,9}")) {
            return Integer.parseInt(value.asText().trim());
        }
        throw new InvalidRequirementMatrixException(
                "Required count for " + topic + " / " + level + " must be a non-negative integer, got " + value);
    }

    private int sum(int a, int b, String topic) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new InvalidRequirementMatrixException("Required count for " + topic + " exceeds " + Integer.MAX_VALUE);
        }
    }

    private String text(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) return null;
        return node.asText();
    }
}
