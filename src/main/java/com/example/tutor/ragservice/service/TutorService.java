package com.example.tutor.ragservice.service;

import com.example.tutor.ragservice.config.RetrievalProperties;
import com.example.tutor.ragservice.config.VectorStoreProperties;
import com.example.tutor.ragservice.dto.AnswerResponse;
import com.example.tutor.ragservice.dto.OperationResult;
import com.example.tutor.ragservice.dto.Passage;
import com.example.tutor.ragservice.dto.RankedPassages;
import com.example.tutor.ragservice.dto.TutorAnswer;
import com.example.tutor.ragservice.exception.ApiErrorException;
import com.example.tutor.ragservice.model.CollectionStats;
import com.example.tutor.ragservice.model.RerankedResult;
import com.example.tutor.ragservice.model.SearchResult;
import com.example.tutor.ragservice.model.StoreResult;
import com.example.tutor.ragservice.retrieval.QueryPlanner;
import com.example.tutor.ragservice.retrieval.QuestionAnalysis;
import com.example.tutor.ragservice.retrieval.RetrievalOrchestrator;
import com.example.tutor.ragservice.store.StoreUnavailableException;
import com.example.tutor.ragservice.store.VectorStoreManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query path: question -> analysis and reformulated queries -> multi-query retrieval ->
 * rerank -> answer. Also hosts the store maintenance operations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TutorService {

    private final QueryPlanner queryPlanner;
    private final RetrievalOrchestrator orchestrator;
    private final AnswerService answerService;
    private final VectorStoreManager vectorStore;
    private final RetrievalProperties retrievalProps;
    private final VectorStoreProperties vectorProps;

    public RankedPassages retrieveAndRank(String question, Integer topK) {
        String q = requireQuestion(question);
        QuestionAnalysis analysis = queryPlanner.analyze(q);
        return rank(q, analysis, topK);
    }

    public AnswerResponse ask(String question) {
        String q = requireQuestion(question);
        log.info("Processing question: {}", q);
        QuestionAnalysis analysis = queryPlanner.analyze(q);
        RankedPassages ranked = rank(q, analysis, null);
        TutorAnswer answer = answerService.compose(q, analysis, ranked.passages());

        Map<String, Object> metadata = new LinkedHashMap<>(answer.metadata());
        if (ranked.degraded()) {
            metadata.put("retrieval_note", ranked.note());
        }
        return new AnswerResponse(q, answer.answer(), analysis, ranked.queries(), metadata, answer.supportingDocuments());
    }

    public CollectionStats storeStats() {
        return vectorStore.stats();
    }

    public OperationResult clearStore() {
        try {
            vectorStore.clear();
            return OperationResult.ok("Vector store cleared successfully");
        } catch (StoreUnavailableException e) {
            log.error("Error clearing collection: {}", e.getMessage());
            return OperationResult.failed(e.getMessage());
        }
    }

    public OperationResult deleteChunks(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return OperationResult.failed("No IDs provided");
        }
        try {
            vectorStore.delete(ids);
            return OperationResult.ok("Deleted " + ids.size() + " chunk ids");
        } catch (StoreUnavailableException e) {
            log.error("Error deleting chunks: {}", e.getMessage());
            return OperationResult.failed(e.getMessage());
        }
    }

    public Map<String, Object> systemStatus() {
        CollectionStats stats = vectorStore.stats();
        Map<String, Object> components = new LinkedHashMap<>();
        components.put("vector_store", stats.note() == null ? "connected" : "unavailable");
        components.put("query_planner", "ready");
        components.put("retrieval", "ready");
        components.put("answer_composer", "ready");

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("collection_name", stats.collectionName());
        config.put("backend", vectorProps.getBackend().name().toLowerCase());
        config.put("metric", vectorProps.getMetric().name().toLowerCase());
        config.put("embedding_dimension", vectorProps.getEmbeddingDimension());
        config.put("default_k", retrievalProps.getDefaultK());
        config.put("rerank_enabled", retrievalProps.isRerankEnabled());

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", stats.note() == null ? "operational" : "degraded");
        status.put("components", components);
        status.put("config", config);
        return status;
    }

    private RankedPassages rank(String question, QuestionAnalysis analysis, Integer topK) {
        int k = topK != null && topK > 0 ? topK : retrievalProps.getDefaultK();
        List<String> queries = queryPlanner.searchQueries(question, analysis);
        StoreResult<List<SearchResult>> retrieved = orchestrator.retrieve(queries, k);
        List<RerankedResult> reranked = orchestrator.rerank(question, retrieved.value());

        List<Passage> passages = new ArrayList<>(reranked.size());
        for (int i = 0; i < reranked.size(); i++) {
            passages.add(Passage.of(reranked.get(i), i + 1));
        }
        return new RankedPassages(question, queries, passages, retrieved.isDegraded(), retrieved.note());
    }

    private static String requireQuestion(String question) {
        if (question == null || question.isBlank()) {
            throw new ApiErrorException("INVALID_QUESTION", "Question must not be blank", 400, Map.of());
        }
        return question.trim();
    }
}
