package com.example.tutor.ragservice.service;

import com.example.tutor.ragservice.dto.Passage;
import com.example.tutor.ragservice.dto.TutorAnswer;
import com.example.tutor.ragservice.retrieval.QuestionAnalysis;
import dev.langchain4j.model.chat.ChatLanguageModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerService {

    static final int CONTEXT_PASSAGES = 5;
    static final int SUPPORTING_PASSAGES = 3;
    private static final int PASSAGE_PREFIX = 800;

    private final ChatLanguageModel chatModel;

    /**
     * RAG-based tutoring answer using the ranked passages as context. Model failures
     * produce an apology answer rather than an exception.
     */
    public TutorAnswer compose(String question, QuestionAnalysis analysis, List<Passage> passages) {
        StringBuilder context = new StringBuilder();
        List<Passage> used = passages.subList(0, Math.min(CONTEXT_PASSAGES, passages.size()));
        for (int i = 0; i < used.size(); i++) {
            Passage p = used.get(i);
            if (i > 0) context.append("\n\n---\n\n");
            context.append(String.format(Locale.ROOT, "[Document %d - Relevance: %.2f]%n", i + 1, p.relevanceScore()));
            context.append(p.content().length() > PASSAGE_PREFIX ? p.content().substring(0, PASSAGE_PREFIX) : p.content());
        }

        String prompt = buildTutorPrompt(question, analysis, context.toString());
        List<Passage> supporting = List.copyOf(passages.subList(0, Math.min(SUPPORTING_PASSAGES, passages.size())));

        try {
            String answer = chatModel.generate(prompt);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("documents_used", passages.size());
            metadata.put("question_type", analysis.questionType());
            metadata.put("complexity", analysis.complexity());
            metadata.put("response_length", answer == null ? 0 : answer.length());
            log.info("Generated tutoring response ({} chars)", metadata.get("response_length"));
            return new TutorAnswer(answer, metadata, supporting);
        } catch (RuntimeException e) {
            log.error("Error generating response: {}", e.getMessage());
            return new TutorAnswer(
                    "I apologize, but I encountered an error while generating the response. Please try again.\nError: "
                            + e.getMessage(),
                    Map.of("error", String.valueOf(e.getMessage())),
                    List.of());
        }
    }

    private String buildTutorPrompt(String question, QuestionAnalysis analysis, String context) {
        return String.format("""
            You are an expert tutor. Answer the student's question using the reference documents below.

            QUESTION: %s

            QUESTION ANALYSIS:
            topic: %s
            type: %s
            complexity: %s
            key concepts: %s

            RELEVANT DOCUMENTS:
            %s

            INSTRUCTIONS:
            - Answer the question clearly and accurately, explaining concepts in an educational manner
            - Support the answer with the documents above and cite them as [Doc 1], [Doc 2], ...
            - If the documents are insufficient, say so and explain what additional information would help
            - Add examples or analogies where they help understanding
            - Structure the response as: Direct Answer, Detailed Explanation, Supporting Evidence,
              Examples/Analogies, Follow-up Suggestions

            ANSWER:""",
                question,
                analysis.topic(),
                analysis.questionType(),
                analysis.complexity(),
                String.join(", ", analysis.keyConcepts()),
                context.isEmpty() ? "(no documents retrieved)" : context);
    }
}
