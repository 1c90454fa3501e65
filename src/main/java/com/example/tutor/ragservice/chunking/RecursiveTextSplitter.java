package com.example.tutor.ragservice.chunking;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits text on the first separator that occurs in it, recursing with the remaining
 * separators into any piece still longer than the chunk size. Small pieces are merged
 * back into chunks, carrying up to {@code chunkOverlap} characters of the previous chunk.
 */
@Slf4j
public class RecursiveTextSplitter {

    private final int chunkSize;
    private final int chunkOverlap;
    private final List<String> separators;
    private final boolean keepSeparator;

    public RecursiveTextSplitter(int chunkSize, int chunkOverlap, List<String> separators, boolean keepSeparator) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = Math.max(0, Math.min(chunkOverlap, chunkSize - 1));
        this.separators = separators == null || separators.isEmpty() ? List.of("") : List.copyOf(separators);
        this.keepSeparator = keepSeparator;
    }

    public List<String> split(String text) {
        return split(text == null ? "" : text, separators);
    }

    private List<String> split(String text, List<String> candidates) {
        String separator = candidates.get(candidates.size() - 1);
        List<String> remaining = List.of();
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                remaining = candidates.subList(i + 1, candidates.size());
                break;
            }
        }

        String joiner = keepSeparator ? "" : separator;
        List<String> result = new ArrayList<>();
        List<String> fitting = new ArrayList<>();
        for (String piece : splitOn(text, separator)) {
            if (piece.length() <= chunkSize) {
                fitting.add(piece);
                continue;
            }
            if (!fitting.isEmpty()) {
                result.addAll(merge(fitting, joiner));
                fitting.clear();
            }
            if (remaining.isEmpty()) {
                result.add(piece);
            } else {
                result.addAll(split(piece, remaining));
            }
        }
        if (!fitting.isEmpty()) {
            result.addAll(merge(fitting, joiner));
        }
        return result;
    }

    private List<String> splitOn(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            for (int i = 0; i < text.length(); i++) {
                pieces.add(String.valueOf(text.charAt(i)));
            }
            return pieces;
        }
        int from = 0;
        int at;
        while ((at = text.indexOf(separator, from)) >= 0) {
            int end = keepSeparator ? at + separator.length() : at;
            addIfNotEmpty(pieces, text.substring(from, end));
            from = at + separator.length();
        }
        addIfNotEmpty(pieces, text.substring(from));
        return pieces;
    }

    private List<String> merge(List<String> pieces, String joiner) {
        int joinerLength = joiner.length();
        List<String> chunks = new ArrayList<>();
        Deque<String> current = new ArrayDeque<>();
        int total = 0;

        for (String piece : pieces) {
            int length = piece.length();
            if (total + length + (current.isEmpty() ? 0 : joinerLength) > chunkSize && !current.isEmpty()) {
                if (total > chunkSize) {
                    log.debug("Merged chunk of {} chars exceeds chunk size {}", total, chunkSize);
                }
                addIfNotBlank(chunks, String.join(joiner, current));
                // keep a tail of the previous chunk as overlap
                while (!current.isEmpty() && (total > chunkOverlap
                        || total + length + joinerLength > chunkSize)) {
                    total -= current.pollFirst().length() + (current.isEmpty() ? 0 : joinerLength);
                }
            }
            current.addLast(piece);
            total += length + (current.size() > 1 ? joinerLength : 0);
        }
        addIfNotBlank(chunks, String.join(joiner, current));
        return chunks;
    }

    private static void addIfNotEmpty(List<String> target, String piece) {
        if (!piece.isEmpty()) {
            target.add(piece);
        }
    }

    private static void addIfNotBlank(List<String> target, String chunk) {
        String stripped = chunk.strip();
        if (!stripped.isEmpty()) {
            target.add(stripped);
        }
    }
}
