package com.example.tutor.ragservice.chunking;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ChunkingStrategy {
    RECURSIVE("recursive"),
    SEMANTIC("semantic"),
    MARKDOWN("markdown"),
    PARAGRAPH("paragraph"),
    SENTENCE("sentence"),
    SLIDING_WINDOW("sliding_window");

    private final String strategyName;

    ChunkingStrategy(String strategyName) {
        this.strategyName = strategyName;
    }

    public String strategyName() {
        return strategyName;
    }

    public static Optional<ChunkingStrategy> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.strategyName.equals(normalized))
                .findFirst();
    }
}
