package com.example.tutor.ragservice.dto;

import java.util.List;

/** Documents to ingest; {@code strategy} is a chunking strategy name or {@code auto}. */
public record IngestRequest(List<DocumentPayload> documents, String strategy) {
}
