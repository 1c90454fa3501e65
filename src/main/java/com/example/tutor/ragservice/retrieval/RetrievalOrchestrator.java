package com.example.tutor.ragservice.retrieval;

import com.example.tutor.ragservice.chunking.ContentHashing;
import com.example.tutor.ragservice.config.RetrievalProperties;
import com.example.tutor.ragservice.model.RerankedResult;
import com.example.tutor.ragservice.model.SearchResult;
import com.example.tutor.ragservice.model.StoreResult;
import com.example.tutor.ragservice.store.VectorStoreManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Multi-query retrieval: fans a question's reformulations out to the vector store,
 * merges the hits once (dedup, sort, truncate) and reorders them with the relevance judge.
 */
@Slf4j
@Service
public class RetrievalOrchestrator {

    private final VectorStoreManager vectorStore;
    private final RelevanceJudge judge;
    private final RetrievalProperties props;
    private final Executor executor;

    public RetrievalOrchestrator(VectorStoreManager vectorStore,
                                 RelevanceJudge judge,
                                 RetrievalProperties props,
                                 @Qualifier("retrievalExecutor") Executor executor) {
        this.vectorStore = vectorStore;
        this.judge = judge;
        this.props = props;
        this.executor = executor;
    }

    /**
     * Searches every query, keeps the first occurrence of each content fingerprint, sorts
     * by similarity and truncates to {@code k}. The result is DEGRADED when at least one
     * query could not be answered.
     */
    public StoreResult<List<SearchResult>> retrieve(List<String> queries, int k) {
        if (queries == null || queries.isEmpty() || k <= 0) {
            return StoreResult.ok(List.of());
        }

        List<CompletableFuture<StoreResult<List<SearchResult>>>> pending = queries.stream()
                .map(q -> CompletableFuture.supplyAsync(() -> vectorStore.search(q, k), executor))
                .toList();

        // one deadline shared by every query
        long deadline = System.nanoTime() + props.getQueryTimeout().toNanos();
        List<SearchResult> all = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            StoreResult<List<SearchResult>> result = await(pending.get(i), queries.get(i), deadline);
            all.addAll(result.value());
            if (result.isDegraded()) {
                notes.add(result.note());
            }
        }

        Map<String, SearchResult> unique = new LinkedHashMap<>();
        for (SearchResult r : all) {
            unique.putIfAbsent(ContentHashing.fingerprint(r.content()), r);
        }
        List<SearchResult> sorted = new ArrayList<>(unique.values());
        sorted.sort(Comparator.comparingDouble(SearchResult::score).reversed());

        List<SearchResult> top = new ArrayList<>(Math.min(k, sorted.size()));
        for (int i = 0; i < sorted.size() && i < k; i++) {
            SearchResult r = sorted.get(i);
            top.add(new SearchResult(r.id(), r.content(), r.metadata(), r.score(), r.distance(), i + 1));
        }

        log.info("Retrieved {} unique passages from {} candidates over {} queries", unique.size(), all.size(), queries.size());
        return notes.isEmpty() ? StoreResult.ok(top) : StoreResult.degraded(top, String.join("; ", notes));
    }

    /**
     * Reorders candidates by judged relevance, best first, keeping input order on ties.
     * Candidates the judge did not score keep their similarity score. If the judge fails
     * the input comes back in its original order.
     */
    public List<RerankedResult> rerank(String question, List<SearchResult> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<RerankedResult> unjudged = candidates.stream().map(RerankedResult::unjudged).toList();
        if (!props.isRerankEnabled()) {
            return unjudged;
        }

        int prefix = props.getRerankPrefixChars();
        List<String> passages = candidates.stream()
                .map(c -> c.content().length() > prefix ? c.content().substring(0, prefix) : c.content())
                .toList();

        List<Double> scores;
        try {
            scores = judge.score(question, passages);
        } catch (RuntimeException e) {
            log.warn("Reranking skipped, keeping retrieval order: {}", e.getMessage());
            return unjudged;
        }

        List<RerankedResult> reranked = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            SearchResult c = candidates.get(i);
            Double score = i < scores.size() ? scores.get(i) : null;
            reranked.add(new RerankedResult(c, score != null ? score : c.score()));
        }
        reranked.sort(Comparator.comparingDouble(RerankedResult::relevanceScore).reversed());
        log.info("Reranked {} passages ({} judged)", reranked.size(), Math.min(scores.size(), candidates.size()));
        return reranked;
    }

    private StoreResult<List<SearchResult>> await(CompletableFuture<StoreResult<List<SearchResult>>> future,
                                                  String query, long deadline) {
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Query '{}' timed out after {}", query, props.getQueryTimeout());
            return StoreResult.degraded(List.of(), "Query timed out: " + query);
        } catch (ExecutionException e) {
            log.warn("Query '{}' failed: {}", query, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return StoreResult.degraded(List.of(), "Query failed: " + query);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StoreResult.degraded(List.of(), "Interrupted while waiting for query: " + query);
        }
    }
}
