package com.example.tutor.ragservice.model;

public record CollectionStats(String collectionName, long totalChunks, String note) {
}
