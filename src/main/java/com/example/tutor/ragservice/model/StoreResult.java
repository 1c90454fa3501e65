package com.example.tutor.ragservice.model;

/**
 * Outcome of a read against the vector store. A {@code DEGRADED} result carries a
 * fallback value (empty list, zero stats) and a note explaining why.
 */
public record StoreResult<T>(T value, Status status, String note) {

    public enum Status { OK, DEGRADED }

    public static <T> StoreResult<T> ok(T value) {
        return new StoreResult<>(value, Status.OK, null);
    }

    public static <T> StoreResult<T> degraded(T fallback, String note) {
        return new StoreResult<>(fallback, Status.DEGRADED, note);
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}
