package com.example.tutor.ragservice.dto;

public record TextIngestRequest(String text, String source, String strategy) {
}
