package com.example.tutor.ragservice.retrieval;

import java.util.List;

/**
 * External relevance judgement used to rerank retrieved passages.
 */
public interface RelevanceJudge {

    /**
     * Scores each passage's relevance to the question, in input order. The returned list
     * may be shorter than the input.
     *
     * @throws RerankException when the judge is unavailable or answers malformed output
     */
    List<Double> score(String question, List<String> passages);
}
