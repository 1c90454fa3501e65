package com.example.tutor.ragservice.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A raw document handed to the chunking pipeline. Immutable: enrichment returns a copy.
 */
public record Document(String id, String content, String source, Map<String, Object> metadata) {

    public Document {
        content = content == null ? "" : content;
        source = source == null || source.isBlank() ? "unknown" : source;
        metadata = Metadata.immutableCopy(metadata);
    }

    public Document withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new Document(id, content, source, merged);
    }
}
