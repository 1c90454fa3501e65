package com.example.tutor.ragservice.store;

import com.example.tutor.ragservice.model.StoredChunk;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;

/**
 * Chunk collection held in process. When a snapshot path is configured every mutation
 * is written to a JSON file first, so the collection survives restarts and a failed
 * write leaves the previous state in place.
 */
@Slf4j
public class InMemoryChunkCollection implements ChunkCollection {

    private static final TypeReference<List<StoredChunk>> SNAPSHOT_TYPE = new TypeReference<>() {};

    private final String collectionName;
    private final Path snapshot;
    private final SimilarityMetric metric;
    private final ObjectMapper objectMapper;

    private Map<String, StoredChunk> chunks = new LinkedHashMap<>();

    public InMemoryChunkCollection(String collectionName, Path snapshot, SimilarityMetric metric, ObjectMapper objectMapper) {
        this.collectionName = collectionName;
        this.snapshot = snapshot;
        this.metric = metric;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return collectionName;
    }

    @Override
    public synchronized void open() {
        if (snapshot == null || !Files.exists(snapshot)) {
            return;
        }
        try {
            Map<String, StoredChunk> loaded = new LinkedHashMap<>();
            for (StoredChunk chunk : objectMapper.readValue(snapshot.toFile(), SNAPSHOT_TYPE)) {
                loaded.put(chunk.getId(), chunk);
            }
            chunks = loaded;
            log.info("Loaded existing collection '{}' with {} chunks from {}", collectionName, loaded.size(), snapshot);
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot read snapshot " + snapshot, e);
        }
    }

    @Override
    public synchronized void upsert(List<StoredChunk> toAdd) {
        Map<String, StoredChunk> next = new LinkedHashMap<>(chunks);
        for (StoredChunk chunk : toAdd) {
            next.remove(chunk.getId());
            next.put(chunk.getId(), chunk);
        }
        commit(next);
    }

    @Override
    public synchronized void delete(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        Map<String, StoredChunk> next = new LinkedHashMap<>(chunks);
        ids.forEach(next::remove);
        commit(next);
    }

    @Override
    public synchronized void deleteAll() {
        commit(new LinkedHashMap<>());
    }

    @Override
    public synchronized long count() {
        return chunks.size();
    }

    @Override
    public synchronized long maxSequence() {
        return chunks.values().stream().mapToLong(StoredChunk::getSeq).max().orElse(0L);
    }

    @Override
    public List<ScoredChunk> nearest(float[] query, int k, Map<String, Object> filter) {
        List<StoredChunk> view;
        synchronized (this) {
            view = List.copyOf(chunks.values());
        }
        return ChunkCollection.rankInProcess(view.stream(), query, k, filter, metric);
    }

    private void commit(Map<String, StoredChunk> next) {
        if (snapshot != null) {
            try {
                if (snapshot.getParent() != null) {
                    Files.createDirectories(snapshot.getParent());
                }
                Path tmp = snapshot.resolveSibling(snapshot.getFileName() + ".tmp");
                objectMapper.writeValue(tmp.toFile(), new ArrayList<>(next.values()));
                Files.move(tmp, snapshot, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new StoreUnavailableException("Cannot write snapshot " + snapshot, e);
            }
        }
        chunks = next;
    }
}
