package com.example.tutor.ragservice.model;

import java.util.Map;

/**
 * A bounded span of a document's text, the atomic retrievable unit.
 */
public record Chunk(
        String id,
        String documentId,
        String content,
        int index,
        int totalChunks,
        int tokenCount,
        int charCount,
        String strategy,
        Map<String, Object> metadata
) {
    public Chunk {
        metadata = Metadata.immutableCopy(metadata);
    }
}
