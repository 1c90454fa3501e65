package com.example.tutor.ragservice.model;

import lombok.*;
import org.springframework.data.annotation.Id;

import java.util.List;
import java.util.Map;

/**
 * Persisted form of a chunk: content, metadata and its embedding.
 */
@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class StoredChunk {
    @Id
    private String id;
    private String documentId;            // owning document
    private String text;                  // chunk content
    private List<Double> embedding;       // vector embedding
    private Map<String, Object> metadata; // index, strategy, source, etc.
    private long seq;                     // insertion sequence, breaks score ties
}
