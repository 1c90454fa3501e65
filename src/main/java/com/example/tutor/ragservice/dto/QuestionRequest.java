package com.example.tutor.ragservice.dto;

public record QuestionRequest(String question, Integer topK) {
}
