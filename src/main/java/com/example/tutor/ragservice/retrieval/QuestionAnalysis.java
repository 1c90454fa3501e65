package com.example.tutor.ragservice.retrieval;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

public record QuestionAnalysis(
        String topic,
        List<String> keyConcepts,
        String questionType,
        String complexity,
        List<String> assumptions,
        List<String> relatedConcepts
) {
    public QuestionAnalysis {
        topic = topic == null ? "unknown" : topic;
        keyConcepts = keyConcepts == null ? List.of() : List.copyOf(keyConcepts);
        questionType = questionType == null ? "factual" : questionType;
        complexity = complexity == null ? "basic" : complexity;
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
        relatedConcepts = relatedConcepts == null ? List.of() : List.copyOf(relatedConcepts);
    }

    public static QuestionAnalysis unknown() {
        return new QuestionAnalysis(null, null, null, null, null, null);
    }

    /**
     * Reads an analysis field by field. A field with an unexpected shape falls back to its
     * default without discarding the others; a single value where a list is expected
     * becomes a list of one.
     */
    public static QuestionAnalysis from(JsonNode root) {
        if (root == null || !root.isObject()) {
            return unknown();
        }
        return new QuestionAnalysis(
                text(root, "topic", "main_topic", "subject"),
                list(root, "key_concepts", "keyConcepts"),
                text(root, "question_type", "questionType"),
                text(root, "complexity", "complexity_level"),
                list(root, "assumptions"),
                list(root, "related_concepts", "relatedConcepts"));
    }

    private static JsonNode field(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode node = root.get(name);
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return null;
    }

    private static String text(JsonNode root, String... names) {
        JsonNode node = field(root, names);
        if (node == null || !node.isValueNode() || node.asText().isBlank()) {
            return null;
        }
        return node.asText().trim();
    }

    private static List<String> list(JsonNode root, String... names) {
        JsonNode node = field(root, names);
        if (node == null) {
            return null;
        }
        Iterable<JsonNode> items = node.isArray() ? node : List.of(node);
        List<String> values = new ArrayList<>();
        for (JsonNode item : items) {
            if (item.isValueNode() && !item.isNull() && !item.asText().isBlank()) {
                values.add(item.asText().trim());
            }
        }
        return values;
    }
}
