package com.example.tutor.ragservice.service;

import com.example.tutor.ragservice.chunking.ChunkAssembler;
import com.example.tutor.ragservice.dto.IngestReport;
import com.example.tutor.ragservice.exception.ApiErrorException;
import com.example.tutor.ragservice.model.Chunk;
import com.example.tutor.ragservice.model.Document;
import com.example.tutor.ragservice.store.VectorStoreManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Ingestion path: document -> chunks -> embeddings -> collection. A failing document is
 * counted and reported; the rest of the batch still goes through.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestService {

    private final ChunkAssembler chunkAssembler;
    private final VectorStoreManager vectorStore;
    private final DocumentLoader documentLoader;

    public IngestReport ingest(List<Document> documents, String strategy) {
        int ingested = 0;
        int chunksStored = 0;
        List<String> errors = new ArrayList<>();

        for (Document document : documents) {
            try {
                List<Chunk> chunks = chunkAssembler.assemble(document, strategy);
                chunksStored += vectorStore.add(chunks);
                ingested++;
            } catch (RuntimeException e) {
                log.error("Failed to ingest document from {}: {}", document.source(), e.getMessage());
                errors.add(document.source() + ": " + e.getMessage());
            }
        }

        log.info("Ingested {} documents ({} chunks), {} failed", ingested, chunksStored, errors.size());
        return new IngestReport(ingested, chunksStored, errors.size(), errors);
    }

    public IngestReport ingestText(String text, String source, String strategy) {
        String label = source == null || source.isBlank() ? "user_input" : source;
        Document document = new Document(null, text, label, Map.of("type", "text", "source", label));
        return ingest(List.of(document), strategy);
    }

    public IngestReport ingestDirectory(Path directory, boolean recursive, String strategy) {
        if (!Files.isDirectory(directory)) {
            throw new ApiErrorException("DIRECTORY_NOT_FOUND", "Directory not found", 404,
                    Map.of("path", directory.toString()));
        }

        List<Path> files;
        try {
            files = documentLoader.listSupported(directory, recursive);
        } catch (IOException e) {
            throw new ApiErrorException("DIRECTORY_READ_FAILED", "Failed to list directory", 500,
                    Map.of("path", directory.toString(), "reason", String.valueOf(e.getMessage())));
        }

        List<Document> documents = new ArrayList<>();
        List<String> loadErrors = new ArrayList<>();
        for (Path file : files) {
            try {
                documents.addAll(documentLoader.load(file));
            } catch (IOException | RuntimeException e) {
                log.error("Error loading {}: {}", file, e.getMessage());
                loadErrors.add(file.getFileName() + ": " + e.getMessage());
            }
        }
        log.info("Loaded {} documents from {} files in {}", documents.size(), files.size(), directory);

        IngestReport report = ingest(documents, strategy);
        if (loadErrors.isEmpty()) {
            return report;
        }
        List<String> errors = new ArrayList<>(loadErrors);
        errors.addAll(report.errors());
        return new IngestReport(report.documentsIngested(), report.chunksStored(), report.failed() + loadErrors.size(), errors);
    }
}
