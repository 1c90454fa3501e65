package com.example.tutor.ragservice.dto;

public record OperationResult(boolean success, String message) {

    public static OperationResult ok(String message) {
        return new OperationResult(true, message);
    }

    public static OperationResult failed(String message) {
        return new OperationResult(false, message);
    }
}
