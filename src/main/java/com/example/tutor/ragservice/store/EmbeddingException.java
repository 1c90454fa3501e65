package com.example.tutor.ragservice.store;

/**
 * The embedding provider failed or returned unusable vectors. Nothing was written.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
