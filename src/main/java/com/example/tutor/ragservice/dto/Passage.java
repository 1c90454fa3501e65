package com.example.tutor.ragservice.dto;

import com.example.tutor.ragservice.model.RerankedResult;
import com.example.tutor.ragservice.model.SearchResult;

import java.util.Map;

/** A retrieved passage as returned to callers, positioned after reranking. */
public record Passage(
        int rank,
        String id,
        String content,
        double score,
        double distance,
        double relevanceScore,
        Map<String, Object> metadata
) {
    public static Passage of(RerankedResult reranked, int rank) {
        SearchResult r = reranked.result();
        return new Passage(rank, r.id(), r.content(), r.score(), r.distance(), reranked.relevanceScore(), r.metadata());
    }
}
