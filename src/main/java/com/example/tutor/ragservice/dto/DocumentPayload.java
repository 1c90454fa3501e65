package com.example.tutor.ragservice.dto;

import java.util.Map;

public record DocumentPayload(String id, String content, String source, Map<String, Object> metadata) {
}
