package com.example.tutor.ragservice.store;

import com.example.tutor.ragservice.config.VectorStoreProperties;
import com.example.tutor.ragservice.model.Chunk;
import com.example.tutor.ragservice.model.CollectionStats;
import com.example.tutor.ragservice.model.Metadata;
import com.example.tutor.ragservice.model.SearchResult;
import com.example.tutor.ragservice.model.StoreResult;
import com.example.tutor.ragservice.model.StoredChunk;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the chunk collection: embeds and upserts chunks, answers similarity queries,
 * reports stats and clears. Writes are serialized; reads run concurrently.
 */
@Slf4j
@Service
public class VectorStoreManager {

    private final ChunkCollection collection;
    private final EmbeddingModel embeddingModel;
    private final VectorStoreProperties props;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong sequence = new AtomicLong();
    private volatile boolean opened;

    public VectorStoreManager(ChunkCollection collection, EmbeddingModel embeddingModel, VectorStoreProperties props) {
        this.collection = collection;
        this.embeddingModel = embeddingModel;
        this.props = props;
    }

    /**
     * Opens the configured collection, creating it when missing. A store that is down at
     * startup is retried on the next operation.
     */
    @PostConstruct
    public void initialize() {
        lock.writeLock().lock();
        try {
            ensureOpen();
            log.info("Collection '{}' ready with {} chunks (dimension {}, metric {})",
                    collection.name(), collection.count(), props.getEmbeddingDimension(), props.getMetric());
        } catch (StoreUnavailableException e) {
            log.warn("Collection '{}' not available at startup: {}", collection.name(), e.getMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Embeds and upserts the chunks. Chunks with blank content are skipped and chunks
     * sharing an id collapse into the last one, so repeated spans are stored once.
     *
     * @return number of distinct chunk ids written
     * @throws EmbeddingException when the provider fails; the collection is left unchanged
     */
    public int add(List<Chunk> chunks) {
        Map<String, Chunk> byId = new LinkedHashMap<>();
        for (Chunk chunk : chunks) {
            if (!chunk.content().isBlank()) {
                byId.put(chunk.id(), chunk);
            }
        }
        List<Chunk> storable = new ArrayList<>(byId.values());
        if (storable.isEmpty()) {
            return 0;
        }
        List<List<Double>> vectors = embedAll(storable);

        lock.writeLock().lock();
        try {
            ensureOpen();
            List<StoredChunk> toSave = new ArrayList<>(storable.size());
            for (int i = 0; i < storable.size(); i++) {
                Chunk chunk = storable.get(i);
                toSave.add(StoredChunk.builder()
                        .id(chunk.id())
                        .documentId(chunk.documentId())
                        .text(chunk.content())
                        .embedding(vectors.get(i))
                        .metadata(new LinkedHashMap<>(chunk.metadata()))
                        .seq(sequence.incrementAndGet())
                        .build());
            }
            collection.upsert(toSave);
            log.info("Added {} chunks to collection '{}'", toSave.size(), collection.name());
            return toSave.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public StoreResult<List<SearchResult>> search(String query, int k) {
        return search(query, k, Map.of());
    }

    /**
     * Returns up to {@code k} nearest chunks, best first, ranked from 1. An empty
     * collection gives an empty OK result; an unavailable store or a failed query
     * embedding gives an empty DEGRADED result.
     */
    public StoreResult<List<SearchResult>> search(String query, int k, Map<String, Object> filter) {
        if (k <= 0 || query == null || query.isBlank()) {
            return StoreResult.ok(List.of());
        }
        float[] queryVector;
        try {
            queryVector = embeddingModel.embed(query).content().vector();
        } catch (RuntimeException e) {
            log.warn("Query embedding failed, returning no results: {}", e.getMessage());
            return StoreResult.degraded(List.of(), "Query embedding failed: " + e.getMessage());
        }

        List<ChunkCollection.ScoredChunk> hits;
        lock.readLock().lock();
        try {
            ensureOpen();
            hits = collection.nearest(queryVector, k, filter);
        } catch (StoreUnavailableException e) {
            log.warn("Search degraded to empty result: {}", e.getMessage());
            return StoreResult.degraded(List.of(), "Store unavailable: " + e.getMessage());
        } finally {
            lock.readLock().unlock();
        }

        SimilarityMetric metric = props.getMetric();
        List<SearchResult> results = new ArrayList<>(hits.size());
        for (int i = 0; i < hits.size(); i++) {
            ChunkCollection.ScoredChunk hit = hits.get(i);
            StoredChunk c = hit.chunk();
            results.add(new SearchResult(
                    c.getId(),
                    c.getText(),
                    Metadata.immutableCopy(c.getMetadata()),
                    hit.score(),
                    metric.distance(hit.score()),
                    i + 1));
        }
        return StoreResult.ok(results);
    }

    /** Never throws: an unavailable store reports zero chunks with a note. */
    public CollectionStats stats() {
        lock.readLock().lock();
        try {
            ensureOpen();
            return new CollectionStats(collection.name(), collection.count(), null);
        } catch (StoreUnavailableException e) {
            log.warn("Stats unavailable for '{}': {}", collection.name(), e.getMessage());
            return new CollectionStats(collection.name(), 0, "Collection not accessible: " + e.getMessage());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Deletes every chunk and leaves an empty collection behind. Idempotent. */
    public void clear() {
        lock.writeLock().lock();
        try {
            ensureOpen();
            collection.deleteAll();
            sequence.set(0);
            log.info("Collection '{}' cleared and recreated", collection.name());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void delete(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            ensureOpen();
            collection.delete(ids);
            log.info("Deleted {} chunk ids from '{}'", ids.size(), collection.name());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String collectionName() {
        return collection.name();
    }

    private List<List<Double>> embedAll(List<Chunk> chunks) {
        List<TextSegment> segments = chunks.stream().map(c -> TextSegment.from(c.content())).toList();
        List<Embedding> embeddings;
        try {
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            embeddings = response == null ? null : response.content();
        } catch (RuntimeException e) {
            log.error("Embedding provider failed for {} chunks: {}", chunks.size(), e.getMessage());
            throw new EmbeddingException("Embedding provider failed: " + e.getMessage(), e);
        }
        if (embeddings == null || embeddings.size() != chunks.size()) {
            throw new EmbeddingException("Expected " + chunks.size() + " embeddings, got "
                    + (embeddings == null ? 0 : embeddings.size()));
        }

        int dimension = props.getEmbeddingDimension();
        List<List<Double>> vectors = new ArrayList<>(embeddings.size());
        for (Embedding embedding : embeddings) {
            float[] v = embedding == null ? new float[0] : embedding.vector();
            if (v.length == 0 || (dimension > 0 && v.length != dimension)) {
                throw new EmbeddingException("Embedding dimension " + v.length
                        + " does not match collection dimension " + dimension);
            }
            List<Double> vector = new ArrayList<>(v.length);
            for (float f : v) vector.add((double) f);
            vectors.add(vector);
        }
        return vectors;
    }

    // callers hold the lock
    private void ensureOpen() {
        if (opened) {
            return;
        }
        synchronized (this) {
            if (!opened) {
                collection.open();
                sequence.set(Math.max(sequence.get(), collection.maxSequence()));
                opened = true;
            }
        }
    }
}
