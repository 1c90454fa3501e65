package com.example.tutor.ragservice.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the chat model for one relevance score in [0, 1] per passage.
 */
@Slf4j
@Component
public class LlmRelevanceJudge implements RelevanceJudge {

    private static final String SYSTEM_PROMPT = """
            You are a document relevance evaluator. Given a question and a list of documents,
            evaluate how relevant each document is to answering the question. Consider:
            1. Direct answer to the question
            2. Supporting evidence
            3. Contextual information
            4. Conceptual relevance

            Return a JSON object {"scores": [...]} with one relevance score between 0 and 1
            per document, in document order.""";

    private final ChatLanguageModel chatModel;
    private final ObjectMapper objectMapper;

    public LlmRelevanceJudge(@Qualifier("jsonChatModel") ChatLanguageModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Double> score(String question, List<String> passages) {
        StringBuilder context = new StringBuilder("Question: ").append(question).append("\n\nDocuments:\n");
        for (int i = 0; i < passages.size(); i++) {
            if (i > 0) context.append("\n---\n");
            context.append("Document ").append(i + 1).append(":\n").append(passages.get(i)).append("...");
        }

        String raw;
        try {
            Response<AiMessage> response = chatModel.generate(
                    SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(context.toString()));
            raw = response == null || response.content() == null ? null : response.content().text();
        } catch (RuntimeException e) {
            throw new RerankException("Relevance judge unavailable: " + e.getMessage(), e);
        }
        if (raw == null || raw.isBlank()) {
            throw new RerankException("Relevance judge returned an empty response");
        }
        return parseScores(raw);
    }

    List<Double> parseScores(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new RerankException("Malformed relevance response", e);
        }
        JsonNode scores = root.isArray() ? root : root.path("scores");
        if (!scores.isArray()) {
            throw new RerankException("Relevance response has no scores array");
        }
        List<Double> out = new ArrayList<>(scores.size());
        for (JsonNode node : scores) {
            if (!node.isNumber()) {
                // positions after a non-numeric entry cannot be trusted to line up
                log.debug("Non-numeric relevance score '{}', truncating", node);
                break;
            }
            out.add(node.asDouble());
        }
        return out;
    }
}
