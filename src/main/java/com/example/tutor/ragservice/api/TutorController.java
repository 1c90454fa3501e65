package com.example.tutor.ragservice.api;

import com.example.tutor.ragservice.dto.AnswerResponse;
import com.example.tutor.ragservice.dto.DeleteChunksRequest;
import com.example.tutor.ragservice.dto.DirectoryIngestRequest;
import com.example.tutor.ragservice.dto.DocumentPayload;
import com.example.tutor.ragservice.dto.IngestReport;
import com.example.tutor.ragservice.dto.IngestRequest;
import com.example.tutor.ragservice.dto.OperationResult;
import com.example.tutor.ragservice.dto.QuestionRequest;
import com.example.tutor.ragservice.dto.RankedPassages;
import com.example.tutor.ragservice.dto.TextIngestRequest;
import com.example.tutor.ragservice.exception.ApiErrorException;
import com.example.tutor.ragservice.model.CollectionStats;
import com.example.tutor.ragservice.model.Document;
import com.example.tutor.ragservice.service.IngestService;
import com.example.tutor.ragservice.service.TutorService;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tutor")
@RequiredArgsConstructor
public class TutorController {

    private final IngestService ingestService;
    private final TutorService tutorService;

    // used when a directory request carries no path
    @Value("${app.ingest.path:}")
    private String defaultPath;

    @PostMapping("/ingest")
    public IngestReport ingest(@RequestBody IngestRequest req) {
        if (req == null || req.documents() == null || req.documents().isEmpty()) {
            throw new ApiErrorException("NO_DOCUMENTS", "No documents provided", 400, Map.of());
        }
        List<Document> documents = req.documents().stream().map(TutorController::toDocument).toList();
        return ingestService.ingest(documents, req.strategy());
    }

    @PostMapping("/ingest/text")
    public IngestReport ingestText(@RequestBody TextIngestRequest req) {
        if (req == null || req.text() == null) {
            throw new ApiErrorException("NO_TEXT", "No text provided", 400, Map.of());
        }
        return ingestService.ingestText(req.text(), req.source(), req.strategy());
    }

    @PostMapping("/ingest/directory")
    public IngestReport ingestDirectory(@RequestBody(required = false) DirectoryIngestRequest req) {
        // prefer body.path, then configured default
        String path = (req != null && req.path() != null && !req.path().isBlank())
                ? req.path()
                : (defaultPath != null && !defaultPath.isBlank() ? defaultPath : null);
        if (path == null) {
            throw new ApiErrorException("NO_PATH",
                    "No path provided. Pass {\"path\": \"/abs/path/dir\"} or set app.ingest.path", 400, Map.of());
        }
        boolean recursive = req == null || req.recursive() == null || req.recursive();
        String strategy = req == null ? null : req.strategy();
        return ingestService.ingestDirectory(Path.of(path).toAbsolutePath().normalize(), recursive, strategy);
    }

    @PostMapping("/retrieve")
    public RankedPassages retrieve(@RequestBody QuestionRequest req) {
        return tutorService.retrieveAndRank(req.question(), req.topK());
    }

    @PostMapping("/ask")
    public AnswerResponse ask(@RequestBody QuestionRequest req) {
        return tutorService.ask(req.question());
    }

    @GetMapping("/stats")
    public CollectionStats stats() {
        return tutorService.storeStats();
    }

    @DeleteMapping("/store")
    public OperationResult clearStore() {
        return tutorService.clearStore();
    }

    @PostMapping("/chunks/delete")
    public OperationResult deleteChunks(@RequestBody DeleteChunksRequest req) {
        return tutorService.deleteChunks(req == null ? null : req.ids());
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return tutorService.systemStatus();
    }

    private static Document toDocument(DocumentPayload p) {
        return new Document(p.id(), p.content(), p.source(), p.metadata());
    }
}
