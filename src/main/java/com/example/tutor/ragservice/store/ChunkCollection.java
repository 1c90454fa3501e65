package com.example.tutor.ragservice.store;

import com.example.tutor.ragservice.model.StoredChunk;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Persistent set of stored chunks keyed by chunk id. Backend failures surface as
 * {@link StoreUnavailableException}.
 */
public interface ChunkCollection {

    String name();

    /** Opens the collection, creating it when missing. Never drops existing data. */
    void open();

    /** Inserts or replaces by id. */
    void upsert(List<StoredChunk> chunks);

    /** Absent ids are ignored. */
    void delete(Collection<String> ids);

    /** Removes every chunk and leaves an empty collection with the same configuration. */
    void deleteAll();

    long count();

    long maxSequence();

    List<ScoredChunk> nearest(float[] query, int k, Map<String, Object> filter);

    record ScoredChunk(StoredChunk chunk, double score) {
    }

    /**
     * Brute-force ranking. Ties keep insertion order because candidates are sorted by
     * sequence first and the score sort is stable.
     */
    static List<ScoredChunk> rankInProcess(Stream<StoredChunk> candidates, float[] query, int k,
                                           Map<String, Object> filter, SimilarityMetric metric) {
        return candidates
                .filter(c -> matches(c, filter))
                .filter(c -> c.getEmbedding() != null && c.getEmbedding().size() == query.length)
                .sorted(Comparator.comparingLong(StoredChunk::getSeq))
                .map(c -> new ScoredChunk(c, metric.score(query, c.getEmbedding())))
                .sorted(Comparator.comparingDouble(ScoredChunk::score).reversed())
                .limit(k)
                .toList();
    }

    static boolean matches(StoredChunk chunk, Map<String, Object> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        Map<String, Object> metadata = chunk.getMetadata() == null ? Map.of() : chunk.getMetadata();
        return filter.entrySet().stream()
                .allMatch(e -> Objects.equals(metadata.get(e.getKey()), e.getValue()));
    }
}
