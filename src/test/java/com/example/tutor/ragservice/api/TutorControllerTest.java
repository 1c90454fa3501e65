package com.example.tutor.ragservice.api;

import com.example.tutor.ragservice.dto.IngestReport;
import com.example.tutor.ragservice.dto.OperationResult;
import com.example.tutor.ragservice.dto.Passage;
import com.example.tutor.ragservice.dto.RankedPassages;
import com.example.tutor.ragservice.exception.ApiErrorException;
import com.example.tutor.ragservice.exception.GlobalExceptionHandler;
import com.example.tutor.ragservice.model.CollectionStats;
import com.example.tutor.ragservice.model.Document;
import com.example.tutor.ragservice.service.IngestService;
import com.example.tutor.ragservice.service.TutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TutorControllerTest {

    private IngestService ingestService;
    private TutorService tutorService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ingestService = mock(IngestService.class);
        tutorService = mock(TutorService.class);
        mvc = MockMvcBuilders.standaloneSetup(new TutorController(ingestService, tutorService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void ingestReturnsReport() throws Exception {
        when(ingestService.ingest(any(), eq("auto"))).thenReturn(new IngestReport(1, 3, 0, List.of()));

        mvc.perform(post("/api/tutor/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documents\": [{\"content\": \"Cells\", \"source\": \"bio.md\"}], \"strategy\": \"auto\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentsIngested").value(1))
                .andExpect(jsonPath("$.chunksStored").value(3));
    }

    @Test
    @SuppressWarnings("unchecked")
    void ingestAcceptsNullMetadataValues() throws Exception {
        when(ingestService.ingest(any(), any())).thenReturn(new IngestReport(1, 1, 0, List.of()));

        mvc.perform(post("/api/tutor/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documents\": [{\"content\": \"Cells\", \"source\": \"bio.md\","
                                + " \"metadata\": {\"author\": null, \"topic\": \"biology\"}}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentsIngested").value(1));

        ArgumentCaptor<List<Document>> captor = ArgumentCaptor.forClass(List.class);
        verify(ingestService).ingest(captor.capture(), any());
        Document sent = captor.getValue().get(0);
        assertEquals(Map.of("topic", "biology"), sent.metadata());
    }

    @Test
    void ingestWithoutDocumentsIsBadRequest() throws Exception {
        mvc.perform(post("/api/tutor/ingest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documents\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("NO_DOCUMENTS"));
    }

    @Test
    void directoryIngestWithoutPathIsBadRequest() throws Exception {
        mvc.perform(post("/api/tutor/ingest/directory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("NO_PATH"));
    }

    @Test
    void retrieveReturnsRankedPassages() throws Exception {
        Passage passage = new Passage(1, "c1", "Osmosis moves water", 0.8, 0.2, 0.9, Map.of("source", "bio.md"));
        when(tutorService.retrieveAndRank("What is osmosis?", 2))
                .thenReturn(new RankedPassages("What is osmosis?", List.of("What is osmosis?"), List.of(passage), false, null));

        mvc.perform(post("/api/tutor/retrieve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"What is osmosis?\", \"topK\": 2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.passages[0].rank").value(1))
                .andExpect(jsonPath("$.passages[0].id").value("c1"))
                .andExpect(jsonPath("$.passages[0].relevanceScore").value(0.9))
                .andExpect(jsonPath("$.degraded").value(false));
    }

    @Test
    void blankQuestionIsRenderedAsError() throws Exception {
        when(tutorService.retrieveAndRank(" ", null))
                .thenThrow(new ApiErrorException("INVALID_QUESTION", "Question must not be blank", 400, Map.of()));

        mvc.perform(post("/api/tutor/retrieve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_QUESTION"))
                .andExpect(jsonPath("$.error.message").value("Question must not be blank"));
    }

    @Test
    void unexpectedFailureIsInternalError() throws Exception {
        when(tutorService.storeStats()).thenThrow(new IllegalStateException("boom"));

        mvc.perform(get("/api/tutor/stats"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.code").value("INTERNAL_ERROR"));
    }

    @Test
    void statsAndClear() throws Exception {
        when(tutorService.storeStats()).thenReturn(new CollectionStats("lessons", 0, null));
        when(tutorService.clearStore()).thenReturn(OperationResult.ok("Vector store cleared successfully"));

        mvc.perform(get("/api/tutor/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.collectionName").value("lessons"))
                .andExpect(jsonPath("$.totalChunks").value(0));

        mvc.perform(delete("/api/tutor/store"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void deleteChunksPassesIds() throws Exception {
        when(tutorService.deleteChunks(List.of("c1", "c2"))).thenReturn(OperationResult.ok("Deleted 2 chunk ids"));

        mvc.perform(post("/api/tutor/chunks/delete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ids\": [\"c1\", \"c2\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Deleted 2 chunk ids"));
    }
}
