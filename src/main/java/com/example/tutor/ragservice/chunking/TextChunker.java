package com.example.tutor.ragservice.chunking;

import com.example.tutor.ragservice.config.ChunkingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits raw text into ordered spans with one of the {@link ChunkingStrategy} algorithms.
 * The result is never empty: empty text yields a single empty chunk.
 */
@Slf4j
@Component
public class TextChunker {

    public static final String AUTO = "auto";

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#{1,3}\\s.*");
    private static final double WORD_BOUNDARY_WINDOW = 0.1;

    private final ChunkingProperties props;
    private final StrategySelector selector;
    private final RecursiveTextSplitter recursiveSplitter;

    public TextChunker(ChunkingProperties props, StrategySelector selector) {
        if (props.getChunkSize() > props.getMaxChunkSize()) {
            throw new IllegalArgumentException("chunk size " + props.getChunkSize()
                    + " exceeds max chunk size " + props.getMaxChunkSize());
        }
        this.props = props;
        this.selector = selector;
        this.recursiveSplitter = new RecursiveTextSplitter(
                props.getChunkSize(), props.getChunkOverlap(), props.getSeparators(), props.isKeepSeparator());
    }

    /** Spans produced for a text plus the name of the algorithm that produced them. */
    public record ChunkedText(List<String> spans, String strategyName) {
    }

    /**
     * Resolves a strategy name: {@code auto} or blank selects from the text, unknown
     * names fall back to recursive.
     */
    public ChunkingStrategy resolve(String requested, String text) {
        if (requested == null || requested.isBlank() || AUTO.equalsIgnoreCase(requested.trim())) {
            return selector.select(text);
        }
        return ChunkingStrategy.fromName(requested).orElseGet(() -> {
            log.warn("Unknown chunking strategy '{}', falling back to recursive", requested);
            return ChunkingStrategy.RECURSIVE;
        });
    }

    public ChunkedText chunk(String text, String requestedStrategy) {
        String t = text == null ? "" : text;
        return chunk(t, resolve(requestedStrategy, t));
    }

    public ChunkedText chunk(String text, ChunkingStrategy strategy) {
        String t = text == null ? "" : text;
        if (t.length() <= props.getChunkSize()) {
            return new ChunkedText(List.of(t), strategy.strategyName());
        }
        try {
            List<String> spans = dispatch(t, strategy);
            log.debug("Chunked {} chars into {} chunks with strategy {}", t.length(), spans.size(), strategy.strategyName());
            return new ChunkedText(spans.isEmpty() ? List.of(t) : spans, strategy.strategyName());
        } catch (ChunkingException | RuntimeException e) {
            log.warn("Strategy {} failed ({}), falling back to recursive", strategy.strategyName(), e.getMessage());
            List<String> spans = recursiveSplitter.split(t);
            return new ChunkedText(spans.isEmpty() ? List.of(t) : spans,
                    ChunkingStrategy.RECURSIVE.strategyName() + "_fallback");
        }
    }

    private List<String> dispatch(String text, ChunkingStrategy strategy) throws ChunkingException {
        return switch (strategy) {
            case RECURSIVE -> recursiveSplitter.split(text);
            case SEMANTIC -> accumulate(paragraphs(text), "\n\n", true);
            case PARAGRAPH -> accumulate(paragraphs(text), "\n\n", false);
            case SENTENCE -> accumulate(List.of(SENTENCE_END.split(text)), " ", false);
            case MARKDOWN -> markdown(text);
            case SLIDING_WINDOW -> slidingWindow(text);
        };
    }

    private static List<String> paragraphs(String text) {
        return List.of(StrategySelector.PARAGRAPH_BREAK.split(text));
    }

    /**
     * Greedily packs units into chunks up to the chunk size. With {@code splitOversized}
     * a unit larger than the chunk size is handed to the recursive splitter, otherwise it
     * is kept whole as its own chunk.
     */
    private List<String> accumulate(List<String> units, String joiner, boolean splitOversized) {
        int chunkSize = props.getChunkSize();
        List<String> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentSize = 0;

        for (String raw : units) {
            String unit = raw.strip();
            if (unit.isEmpty()) {
                continue;
            }
            int size = unit.length();
            if (splitOversized && size > chunkSize) {
                if (!current.isEmpty()) {
                    chunks.add(String.join(joiner, current));
                    current.clear();
                    currentSize = 0;
                }
                chunks.addAll(recursiveSplitter.split(unit));
            } else if (currentSize + size > chunkSize && !current.isEmpty()) {
                chunks.add(String.join(joiner, current));
                current.clear();
                current.add(unit);
                currentSize = size;
            } else {
                if (size > props.getMaxChunkSize()) {
                    log.debug("Keeping oversized unit of {} chars whole", size);
                }
                current.add(unit);
                currentSize += size + joiner.length();
            }
        }
        if (!current.isEmpty()) {
            chunks.add(String.join(joiner, current));
        }
        return chunks;
    }

    private List<String> markdown(String text) throws ChunkingException {
        List<String> sections = new ArrayList<>();
        StringBuilder section = new StringBuilder();
        boolean inFence = false;

        for (String line : text.split("\r?\n", -1)) {
            if (line.strip().startsWith("```")) {
                inFence = !inFence;
            }
            if (!inFence && MARKDOWN_HEADING.matcher(line).matches() && section.length() > 0) {
                addSection(sections, section.toString());
                section.setLength(0);
            }
            section.append(line).append('\n');
        }
        if (inFence) {
            throw new ChunkingException("Unterminated code fence in markdown text");
        }
        addSection(sections, section.toString());

        List<String> chunks = new ArrayList<>();
        String pending = null;
        for (String s : sections) {
            String merged = pending == null ? s : pending + "\n\n" + s;
            if (pending != null && merged.length() > props.getChunkSize()) {
                chunks.add(pending);
                merged = s;
            }
            if (merged.length() < props.getMinChunkSize()) {
                pending = merged;
                continue;
            }
            pending = null;
            if (merged.length() > props.getChunkSize()) {
                chunks.addAll(recursiveSplitter.split(merged));
            } else {
                chunks.add(merged);
            }
        }
        if (pending != null) {
            chunks.add(pending);
        }
        return chunks;
    }

    private static void addSection(List<String> sections, String raw) {
        String s = raw.strip();
        if (!s.isEmpty()) {
            sections.add(s);
        }
    }

    private List<String> slidingWindow(String text) {
        int size = props.getChunkSize();
        int overlap = Math.max(0, props.getChunkOverlap());
        int length = text.length();
        List<String> chunks = new ArrayList<>();
        int start = 0;

        while (start < length) {
            int end = start + size;
            if (end < length) {
                // back off to whitespace within the trailing 10% of the window
                int searchFrom = end - (int) (size * WORD_BOUNDARY_WINDOW);
                int breakPoint = text.lastIndexOf(' ', end - 1);
                if (breakPoint >= searchFrom && breakPoint > start) {
                    end = breakPoint;
                }
            } else {
                end = length;
            }

            String chunk = text.substring(start, end).strip();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }

            int next = end - overlap;
            if (next <= 0 || next >= length || end >= length) {
                break;
            }
            start = next > start ? next : end;
        }
        return chunks;
    }
}
