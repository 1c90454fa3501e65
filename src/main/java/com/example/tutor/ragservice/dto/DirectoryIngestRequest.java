package com.example.tutor.ragservice.dto;

public record DirectoryIngestRequest(String path, Boolean recursive, String strategy) {
}
