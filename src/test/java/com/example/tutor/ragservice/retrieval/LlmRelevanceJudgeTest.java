package com.example.tutor.ragservice.retrieval;

import com.example.tutor.ragservice.support.ScriptedChatModel;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.UserMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LlmRelevanceJudgeTest {

    private final ScriptedChatModel model = new ScriptedChatModel();
    private final LlmRelevanceJudge judge = new LlmRelevanceJudge(model, new ObjectMapper());

    @Test
    void readsScoresObject() {
        model.reply("{\"scores\": [0.9, 0.2]}");

        assertEquals(List.of(0.9, 0.2), judge.score("What is osmosis?", List.of("Osmosis is...", "Unrelated")));

        String prompt = ((UserMessage) model.requests().get(0).get(1)).singleText();
        assertTrue(prompt.contains("Question: What is osmosis?"));
        assertTrue(prompt.contains("Document 1:\nOsmosis is..."));
        assertTrue(prompt.contains("Document 2:\nUnrelated"));
    }

    @Test
    void acceptsBareArray() {
        assertEquals(List.of(0.1, 0.5), judge.parseScores("[0.1, 0.5]"));
    }

    @Test
    void stopsAtFirstNonNumericScore() {
        assertEquals(List.of(0.5), judge.parseScores("{\"scores\": [0.5, \"high\", 0.7]}"));
    }

    @Test
    void malformedResponseIsARerankFailure() {
        assertThrows(RerankException.class, () -> judge.parseScores("scores: none"));
        assertThrows(RerankException.class, () -> judge.parseScores("{\"ranking\": [1]}"));
    }

    @Test
    void modelFailureIsARerankFailure() {
        model.fail(new IllegalStateException("rate limited"));
        RerankException e = assertThrows(RerankException.class, () -> judge.score("q", List.of("p")));
        assertTrue(e.getMessage().contains("rate limited"));
    }

    @Test
    void blankResponseIsARerankFailure() {
        model.reply("  ");
        assertThrows(RerankException.class, () -> judge.score("q", List.of("p")));
    }
}
