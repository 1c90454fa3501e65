package com.example.tutor.ragservice.retrieval;

import com.example.tutor.ragservice.config.RetrievalProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Understands a question and reformulates it into several search queries.
 * Both steps degrade to safe defaults when the model fails.
 */
@Slf4j
@Service
public class QueryPlanner {

    private static final String ANALYSIS_PROMPT = """
            You are a question analysis expert. Analyze the given question and extract:
            1. Main topic/subject ("topic")
            2. Key concepts mentioned ("key_concepts")
            3. Question type: factual, conceptual, analytical, comparative, etc. ("question_type")
            4. Complexity level: basic, intermediate, advanced ("complexity")
            5. Any implicit assumptions or context needed ("assumptions")
            6. Potential related concepts that might be relevant ("related_concepts")

            Return your analysis as a JSON object.""";

    private static final String QUERIES_PROMPT = """
            You are a search query expert. Based on the question and analysis, generate
            multiple search queries that would help find relevant information. Consider:
            1. Direct query matching the question
            2. Broader concept queries
            3. Specific aspect queries
            4. Related concept queries

            Return a JSON object {"queries": [...]} of search strings.""";

    private final ChatLanguageModel chatModel;
    private final ObjectMapper objectMapper;
    private final RetrievalProperties props;

    public QueryPlanner(@Qualifier("jsonChatModel") ChatLanguageModel chatModel,
                        ObjectMapper objectMapper,
                        RetrievalProperties props) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    public QuestionAnalysis analyze(String question) {
        try {
            String raw = chatModel.generate(SystemMessage.from(ANALYSIS_PROMPT), UserMessage.from("Question: " + question))
                    .content().text();
            QuestionAnalysis analysis = QuestionAnalysis.from(objectMapper.readTree(raw));
            log.info("Question analysis completed: topic={}, type={}", analysis.topic(), analysis.questionType());
            return analysis;
        } catch (Exception e) {
            log.warn("Question analysis failed, using defaults: {}", e.getMessage());
            return QuestionAnalysis.unknown();
        }
    }

    /**
     * Returns up to {@code max-queries} distinct queries with the original question first.
     */
    public List<String> searchQueries(String question, QuestionAnalysis analysis) {
        Set<String> queries = new LinkedHashSet<>();
        queries.add(question);
        try {
            String context = "Question: " + question + "\nAnalysis: "
                    + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(analysis);
            String raw = chatModel.generate(SystemMessage.from(QUERIES_PROMPT), UserMessage.from(context))
                    .content().text();
            JsonNode root = objectMapper.readTree(raw);
            JsonNode generated = root.isArray() ? root : root.path("queries");
            for (JsonNode node : generated) {
                if (node.isTextual() && !node.asText().isBlank()) {
                    queries.add(node.asText().trim());
                }
            }
        } catch (Exception e) {
            log.warn("Query generation failed, searching with the question only: {}", e.getMessage());
        }
        List<String> limited = new ArrayList<>(queries).subList(0, Math.min(queries.size(), Math.max(1, props.getMaxQueries())));
        log.info("Generated {} search queries", limited.size());
        return List.copyOf(limited);
    }
}
