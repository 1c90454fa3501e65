package com.example.tutor.ragservice.dto;

import com.example.tutor.ragservice.retrieval.QuestionAnalysis;

import java.util.List;
import java.util.Map;

public record AnswerResponse(
        String question,
        String answer,
        QuestionAnalysis questionAnalysis,
        List<String> queries,
        Map<String, Object> metadata,
        List<Passage> supportingDocuments
) {
}
