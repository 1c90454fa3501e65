package com.example.tutor.ragservice.model;

public record RerankedResult(SearchResult result, double relevanceScore) {

    public static RerankedResult unjudged(SearchResult result) {
        return new RerankedResult(result, result.score());
    }
}
