package com.example.tutor.ragservice.chunking;

import com.example.tutor.ragservice.model.Chunk;
import com.example.tutor.ragservice.model.Document;
import dev.langchain4j.model.Tokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a document into identified chunks: picks the strategy, splits the text and
 * attaches id, position, size and strategy metadata to every span.
 */
@Slf4j
@Component
public class ChunkAssembler {

    private final TextChunker chunker;
    private final Tokenizer tokenizer;

    @Autowired
    public ChunkAssembler(TextChunker chunker, ObjectProvider<Tokenizer> tokenizer) {
        this(chunker, tokenizer.getIfAvailable());
    }

    public ChunkAssembler(TextChunker chunker, Tokenizer tokenizer) {
        this.chunker = chunker;
        this.tokenizer = tokenizer;
    }

    public List<Chunk> assemble(Document document, String requestedStrategy) {
        String documentId = document.id() != null ? document.id() : ContentHashing.documentId(document.source());
        TextChunker.ChunkedText chunked = chunker.chunk(document.content(), requestedStrategy);
        List<String> spans = chunked.spans();

        List<Chunk> chunks = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            String content = spans.get(i);
            int tokens = countTokens(content);

            Map<String, Object> metadata = new LinkedHashMap<>(document.metadata());
            metadata.put("source", document.source());
            metadata.put("document_id", documentId);
            metadata.put("chunk_index", i);
            metadata.put("total_chunks", spans.size());
            metadata.put("token_count", tokens);
            metadata.put("char_count", content.length());
            metadata.put("chunking_strategy", chunked.strategyName());

            chunks.add(new Chunk(
                    ContentHashing.chunkId(documentId, content),
                    documentId,
                    content,
                    i,
                    spans.size(),
                    tokens,
                    content.length(),
                    chunked.strategyName(),
                    metadata));
        }
        log.debug("Assembled {} chunks for document {} ({})", chunks.size(), documentId, chunked.strategyName());
        return chunks;
    }

    int countTokens(String text) {
        if (tokenizer != null) {
            try {
                return tokenizer.estimateTokenCountInText(text);
            } catch (RuntimeException e) {
                log.debug("Tokenizer failed, using word count: {}", e.getMessage());
            }
        }
        String stripped = text.strip();
        return stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
    }
}
