package com.example.tutor.ragservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared configuration for every chunking algorithm.
 */
@Data
@ConfigurationProperties(prefix = "app.chunking")
public class ChunkingProperties {

    private int chunkSize = 1000;
    private int chunkOverlap = 200;
    private int minChunkSize = 100;
    private int maxChunkSize = 2000;

    /** Tried in order by the recursive splitter; the empty separator splits into characters. */
    private List<String> separators = new ArrayList<>(List.of("\n\n", "\n", ". ", "! ", "? ", " ", ""));

    private boolean keepSeparator = true;
}
