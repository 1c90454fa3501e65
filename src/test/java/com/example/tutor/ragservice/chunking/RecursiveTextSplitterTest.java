package com.example.tutor.ragservice.chunking;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecursiveTextSplitterTest {

    private static final List<String> WORDS_THEN_CHARS = List.of(" ", "");

    @Test
    void mergesSmallPiecesUpToChunkSize() {
        RecursiveTextSplitter splitter = new RecursiveTextSplitter(10, 0, WORDS_THEN_CHARS, false);
        assertEquals(List.of("aaa bbb", "ccc ddd"), splitter.split("aaa bbb ccc ddd"));
    }

    @Test
    void carriesOverlapIntoNextChunk() {
        RecursiveTextSplitter splitter = new RecursiveTextSplitter(10, 4, WORDS_THEN_CHARS, false);
        assertEquals(List.of("aaa bbb", "bbb ccc", "ccc ddd"), splitter.split("aaa bbb ccc ddd"));
    }

    @Test
    void oversizedPieceRecursesToNextSeparator() {
        RecursiveTextSplitter splitter = new RecursiveTextSplitter(4, 0, WORDS_THEN_CHARS, false);
        assertEquals(List.of("abcd", "efgh", "ij"), splitter.split("abcdefgh ij"));
    }

    @Test
    void keptSeparatorStaysWithPrecedingPiece() {
        RecursiveTextSplitter splitter = new RecursiveTextSplitter(10, 0, List.of(". ", ""), true);
        assertEquals(List.of("One. Two.", "Three."), splitter.split("One. Two. Three."));
    }

    @Test
    void blankInputYieldsNoChunks() {
        RecursiveTextSplitter splitter = new RecursiveTextSplitter(10, 0, WORDS_THEN_CHARS, true);
        assertTrue(splitter.split("   ").isEmpty());
        assertTrue(splitter.split(null).isEmpty());
    }

    @Test
    void nonPositiveChunkSizeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RecursiveTextSplitter(0, 0, WORDS_THEN_CHARS, true));
    }
}
