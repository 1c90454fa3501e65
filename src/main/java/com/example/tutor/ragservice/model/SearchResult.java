package com.example.tutor.ragservice.model;

import java.util.Map;

/**
 * One hit of a similarity search. Never persisted.
 */
public record SearchResult(String id, String content, Map<String, Object> metadata,
                           double score, double distance, int rank) {
}
