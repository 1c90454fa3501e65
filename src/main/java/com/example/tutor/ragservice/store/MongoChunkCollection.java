package com.example.tutor.ragservice.store;

import com.example.tutor.ragservice.config.VectorStoreProperties;
import com.example.tutor.ragservice.model.StoredChunk;
import com.mongodb.MongoException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.MongoCollection;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.*;
import java.util.function.Supplier;

/**
 * Chunk collection in MongoDB. Similarity search runs as an Atlas {@code $vectorSearch}
 * aggregation when enabled, otherwise cosine is computed in Java over the stored vectors.
 */
@Slf4j
public class MongoChunkCollection implements ChunkCollection {

    private static final int MIN_CANDIDATES = 200;
    private static final int MAX_CANDIDATES = 10_000;
    private static final int CANDIDATES_PER_HIT = 40;

    private final MongoTemplate mongoTemplate;
    private final String collectionName;
    private final String indexName;
    private final boolean useAtlasVector;
    private final SimilarityMetric metric;

    public MongoChunkCollection(MongoTemplate mongoTemplate, VectorStoreProperties props) {
        this.mongoTemplate = mongoTemplate;
        this.collectionName = props.getCollectionName();
        this.indexName = props.getIndexName();
        this.useAtlasVector = props.isUseAtlasVector();
        this.metric = props.getMetric();
    }

    @Override
    public String name() {
        return collectionName;
    }

    @Override
    public void open() {
        guarded("open", () -> {
            if (!mongoTemplate.collectionExists(collectionName)) {
                mongoTemplate.createCollection(collectionName);
                log.info("Created new collection: {}", collectionName);
            }
            return null;
        });
    }

    @Override
    public void upsert(List<StoredChunk> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        guarded("upsert", () -> {
            BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, StoredChunk.class, collectionName);
            for (StoredChunk chunk : chunks) {
                ops.replaceOne(byId(chunk.getId()), chunk, FindAndReplaceOptions.options().upsert());
            }
            return ops.execute();
        });
    }

    @Override
    public void delete(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        guarded("delete", () -> mongoTemplate.remove(
                Query.query(Criteria.where("_id").in(ids)), StoredChunk.class, collectionName));
    }

    @Override
    public void deleteAll() {
        // remove rather than drop so an Atlas search index on the collection survives
        guarded("deleteAll", () -> mongoTemplate.remove(new Query(), collectionName));
        open();
    }

    @Override
    public long count() {
        return guarded("count", () -> mongoTemplate.count(new Query(), collectionName));
    }

    @Override
    public long maxSequence() {
        return guarded("maxSequence", () -> {
            Query last = new Query().with(Sort.by(Sort.Direction.DESC, "seq")).limit(1);
            StoredChunk chunk = mongoTemplate.findOne(last, StoredChunk.class, collectionName);
            return chunk == null ? 0L : chunk.getSeq();
        });
    }

    @Override
    public List<ScoredChunk> nearest(float[] query, int k, Map<String, Object> filter) {
        return guarded("search", () -> useAtlasVector
                ? atlasSearch(query, k, filter)
                : ChunkCollection.rankInProcess(loadCandidates(filter).stream(), query, k, null, metric));
    }

    private List<StoredChunk> loadCandidates(Map<String, Object> filter) {
        Query query = new Query().with(Sort.by(Sort.Direction.ASC, "seq"));
        if (filter != null) {
            filter.forEach((key, value) -> query.addCriteria(Criteria.where("metadata." + key).is(value)));
        }
        return mongoTemplate.find(query, StoredChunk.class, collectionName);
    }

    @SuppressWarnings("unchecked")
    private List<ScoredChunk> atlasSearch(float[] query, int k, Map<String, Object> filter) {
        MongoCollection<Document> col = mongoTemplate.getCollection(collectionName);
        Document vectorSearch = vectorSearchStage(indexName, query, k, filter);
        Document addScore = new Document("$addFields", new Document("score", new Document("$meta", "vectorSearchScore")));
        Document project = new Document("$project", new Document("text", 1)
                .append("documentId", 1).append("metadata", 1).append("seq", 1).append("score", 1));

        AggregateIterable<Document> agg = col.aggregate(List.of(vectorSearch, addScore, project));
        List<ScoredChunk> hits = new ArrayList<>();
        for (Document d : agg) {
            Number seq = (Number) d.get("seq");
            StoredChunk chunk = StoredChunk.builder()
                    .id(d.getString("_id"))
                    .documentId(d.getString("documentId"))
                    .text(d.getString("text"))
                    .metadata((Map<String, Object>) d.get("metadata"))
                    .seq(seq == null ? 0L : seq.longValue())
                    .build();
            double atlasScore = ((Number) d.get("score")).doubleValue();
            hits.add(new ScoredChunk(chunk, metric.fromAtlasScore(atlasScore)));
        }
        return hits;
    }

    /**
     * Builds the {@code $vectorSearch} stage. Atlas rejects more than 10000 candidates, so
     * both the candidate pool (40 per requested hit, at least 200) and the limit are capped.
     */
    static Document vectorSearchStage(String indexName, float[] query, int k, Map<String, Object> filter) {
        Document search = new Document("index", indexName)
                .append("path", "embedding")
                .append("queryVector", toList(query))
                .append("numCandidates", numCandidates(k))
                .append("limit", Math.min(k, MAX_CANDIDATES));
        if (filter != null && !filter.isEmpty()) {
            Document match = new Document();
            filter.forEach((key, value) -> match.append("metadata." + key, value));
            search.append("filter", match);
        }
        return new Document("$vectorSearch", search);
    }

    static int numCandidates(int k) {
        return (int) Math.min(MAX_CANDIDATES, Math.max(MIN_CANDIDATES, (long) k * CANDIDATES_PER_HIT));
    }

    private static Query byId(String id) {
        return Query.query(Criteria.where("_id").is(id));
    }

    private static List<Double> toList(float[] v) {
        List<Double> out = new ArrayList<>(v.length);
        for (float f : v) out.add((double) f);
        return out;
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | MongoException e) {
            throw new StoreUnavailableException("MongoDB " + operation + " failed on " + collectionName, e);
        }
    }
}
