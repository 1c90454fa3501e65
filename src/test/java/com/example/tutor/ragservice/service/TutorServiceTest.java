package com.example.tutor.ragservice.service;

import com.example.tutor.ragservice.config.RetrievalProperties;
import com.example.tutor.ragservice.config.VectorStoreProperties;
import com.example.tutor.ragservice.dto.AnswerResponse;
import com.example.tutor.ragservice.dto.OperationResult;
import com.example.tutor.ragservice.dto.Passage;
import com.example.tutor.ragservice.dto.RankedPassages;
import com.example.tutor.ragservice.exception.ApiErrorException;
import com.example.tutor.ragservice.model.Chunk;
import com.example.tutor.ragservice.retrieval.QueryPlanner;
import com.example.tutor.ragservice.retrieval.RetrievalOrchestrator;
import com.example.tutor.ragservice.store.VectorStoreManager;
import com.example.tutor.ragservice.support.HashingEmbeddingModel;
import com.example.tutor.ragservice.support.ScriptedChatModel;
import com.example.tutor.ragservice.support.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TutorServiceTest {

    private ScriptedChatModel jsonModel;
    private ScriptedChatModel answerModel;
    private VectorStoreManager store;
    private TutorService service;

    @BeforeEach
    void setUp() {
        VectorStoreProperties vectorProps = new VectorStoreProperties();
        vectorProps.setBackend(VectorStoreProperties.Backend.MEMORY);
        vectorProps.setEmbeddingDimension(HashingEmbeddingModel.DIMENSION);
        RetrievalProperties retrievalProps = new RetrievalProperties();
        retrievalProps.setDefaultK(3);

        store = new VectorStoreManager(
                TestFixtures.memoryCollection("lessons"),
                new HashingEmbeddingModel(),
                vectorProps);
        store.initialize();

        jsonModel = new ScriptedChatModel();
        answerModel = new ScriptedChatModel();
        QueryPlanner planner = new QueryPlanner(jsonModel, new ObjectMapper(), retrievalProps);
        RetrievalOrchestrator orchestrator = new RetrievalOrchestrator(
                store, (q, passages) -> passages.stream().map(p -> p.toLowerCase().contains("osmosis") ? 0.9 : 0.1).toList(),
                retrievalProps, Runnable::run);

        service = new TutorService(planner, orchestrator, new AnswerService(answerModel), store, retrievalProps, vectorProps);

        store.add(List.of(
                chunk("c1", "Osmosis is water moving across a membrane"),
                chunk("c2", "A membrane separates the cell from its surroundings"),
                chunk("c3", "Rivers carry sediment to the sea")));
    }

    private static Chunk chunk(String id, String content) {
        return new Chunk(id, "doc_1", content, 0, 1, 0, content.length(), "recursive", Map.of("source", "bio.md"));
    }

    @Test
    void retrieveAndRankReturnsRerankedPassages() {
        jsonModel.reply("{\"topic\": \"osmosis\", \"question_type\": \"conceptual\"}")
                .reply("{\"queries\": [\"membrane transport\"]}");

        RankedPassages ranked = service.retrieveAndRank("What is osmosis?", 2);

        assertEquals(List.of("What is osmosis?", "membrane transport"), ranked.queries());
        assertFalse(ranked.degraded());
        assertEquals(2, ranked.passages().size());
        Passage top = ranked.passages().get(0);
        assertEquals("c1", top.id());
        assertEquals(1, top.rank());
        assertEquals(0.9, top.relevanceScore(), 1e-9);
        assertEquals(2, ranked.passages().get(1).rank());
    }

    @Test
    void plannerOutageStillRetrievesWithTheQuestion() {
        jsonModel.fail(new IllegalStateException("down")).fail(new IllegalStateException("down"));

        RankedPassages ranked = service.retrieveAndRank("What is osmosis?", null);

        assertEquals(List.of("What is osmosis?"), ranked.queries());
        assertEquals("c1", ranked.passages().get(0).id());
    }

    @Test
    void blankQuestionIsRejected() {
        ApiErrorException e = assertThrows(ApiErrorException.class, () -> service.retrieveAndRank("  ", 3));
        assertEquals("INVALID_QUESTION", e.getCode());
        assertEquals(400, e.getStatus());
    }

    @Test
    void askComposesAnswerFromPassages() {
        jsonModel.fail(new IllegalStateException("down")).fail(new IllegalStateException("down"));
        answerModel.reply("Osmosis is the movement of water [Doc 1].");

        AnswerResponse response = service.ask("What is osmosis?");

        assertEquals("Osmosis is the movement of water [Doc 1].", response.answer());
        assertEquals("factual", response.questionAnalysis().questionType());
        assertFalse(response.supportingDocuments().isEmpty());
        assertEquals(3, response.metadata().get("documents_used"));
    }

    @Test
    void askApologisesWhenTheModelFails() {
        jsonModel.fail(new IllegalStateException("down")).fail(new IllegalStateException("down"));
        answerModel.fail(new IllegalStateException("quota exceeded"));

        AnswerResponse response = service.ask("What is osmosis?");

        assertTrue(response.answer().startsWith("I apologize"));
        assertEquals("quota exceeded", response.metadata().get("error"));
    }

    @Test
    void clearStoreTwiceSucceedsAndLeavesNothing() {
        OperationResult first = service.clearStore();
        long afterFirst = service.storeStats().totalChunks();
        OperationResult second = service.clearStore();
        long afterSecond = service.storeStats().totalChunks();

        assertTrue(first.success());
        assertTrue(second.success());
        assertEquals(0, afterFirst);
        assertEquals(0, afterSecond);
    }

    @Test
    void deleteChunksNeedsIds() {
        assertFalse(service.deleteChunks(List.of()).success());
        assertTrue(service.deleteChunks(List.of("c3")).success());
        assertEquals(2, service.storeStats().totalChunks());
    }

    @Test
    void statusReportsComponentsAndConfig() {
        Map<String, Object> status = service.systemStatus();

        assertEquals("operational", status.get("status"));
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) status.get("config");
        assertEquals("lessons", config.get("collection_name"));
        assertEquals("memory", config.get("backend"));
        assertEquals(3, config.get("default_k"));
    }
}
