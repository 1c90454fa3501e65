package com.example.tutor.ragservice.chunking;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StrategySelectorTest {

    private final StrategySelector selector = new StrategySelector();

    @Test
    void headingSelectsMarkdown() {
        assertEquals(ChunkingStrategy.MARKDOWN, selector.select("# Title\n\nBody"));
    }

    @Test
    void fencedCodeSelectsRecursive() {
        assertEquals(ChunkingStrategy.RECURSIVE, selector.select("Example:\n```\nint x = 1;\n```\n"));
    }

    @Test
    void manyIndentedLinesSelectRecursive() {
        String code = "def f():\n    a = 1\n    b = 2\n    c = 3\n    d = 4\n    e = 5\n    return a";
        assertEquals(ChunkingStrategy.RECURSIVE, selector.select(code));
    }

    @Test
    void severalParagraphsSelectParagraph() {
        assertEquals(ChunkingStrategy.PARAGRAPH, selector.select("One.\n\nTwo.\n\nThree.\n\nFour."));
    }

    @Test
    void fifteenShortSentencesSelectSentence() {
        String text = "Cats like warm sun. ".repeat(15);
        assertEquals(300, text.length());
        assertEquals(ChunkingStrategy.SENTENCE, selector.select(text));
    }

    @Test
    void longUnstructuredTextSelectsSlidingWindow() {
        String text = "word ".repeat(2400);
        assertEquals(12000, text.length());
        assertEquals(ChunkingStrategy.SLIDING_WINDOW, selector.select(text));
    }

    @Test
    void shortPlainTextSelectsSemantic() {
        assertEquals(ChunkingStrategy.SEMANTIC, selector.select("Just a short note without much structure"));
    }

    @Test
    void nullAndEmptyTextSelectSemantic() {
        assertEquals(ChunkingStrategy.SEMANTIC, selector.select(null));
        assertEquals(ChunkingStrategy.SEMANTIC, selector.select(""));
    }

    @Test
    void selectionIsDeterministic() {
        String text = "A paragraph.\n\nAnother one.";
        assertEquals(selector.select(text), selector.select(text));
    }
}
