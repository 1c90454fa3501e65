package com.example.tutor.ragservice.chunking;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks a chunking strategy from the surface structure of a text. Pure and deterministic.
 */
@Component
public class StrategySelector {

    static final int MAX_PARAGRAPHS = 3;
    static final int MAX_SENTENCES = 10;
    static final int SENTENCE_TEXT_LIMIT = 5000;
    static final int LONG_TEXT_LIMIT = 10000;
    private static final int MAX_INDENTED_LINES = 5;

    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s", Pattern.MULTILINE);
    private static final Pattern INDENTED_LINE = Pattern.compile("\n    ");
    static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]+\\s");

    public ChunkingStrategy select(String text) {
        String t = text == null ? "" : text;

        if (HEADING.matcher(t).find()) {
            return ChunkingStrategy.MARKDOWN;
        }
        if (t.contains("```") || count(INDENTED_LINE, t) > MAX_INDENTED_LINES) {
            return ChunkingStrategy.RECURSIVE;
        }
        if (PARAGRAPH_BREAK.split(t, -1).length > MAX_PARAGRAPHS) {
            return ChunkingStrategy.PARAGRAPH;
        }
        if (SENTENCE_BREAK.split(t, -1).length > MAX_SENTENCES && t.length() < SENTENCE_TEXT_LIMIT) {
            return ChunkingStrategy.SENTENCE;
        }
        if (t.length() > LONG_TEXT_LIMIT) {
            return ChunkingStrategy.SLIDING_WINDOW;
        }
        return ChunkingStrategy.SEMANTIC;
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
