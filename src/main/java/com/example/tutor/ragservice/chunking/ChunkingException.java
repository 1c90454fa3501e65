package com.example.tutor.ragservice.chunking;

/**
 * Raised by a chunking algorithm that cannot handle its input. Recovered inside the
 * engine by falling back to the recursive algorithm.
 */
public class ChunkingException extends Exception {

    public ChunkingException(String message) {
        super(message);
    }

    public ChunkingException(String message, Throwable cause) {
        super(message, cause);
    }
}
