package com.example.tutor.ragservice.dto;

import java.util.List;

/**
 * Outcome of an ingestion batch. Failures are per document and do not abort the batch.
 */
public record IngestReport(int documentsIngested, int chunksStored, int failed, List<String> errors) {

    public IngestReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean success() {
        return failed == 0 && documentsIngested > 0;
    }
}
