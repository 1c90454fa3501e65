package com.example.tutor.ragservice.dto;

import java.util.List;
import java.util.Map;

public record TutorAnswer(String answer, Map<String, Object> metadata, List<Passage> supportingDocuments) {
}
