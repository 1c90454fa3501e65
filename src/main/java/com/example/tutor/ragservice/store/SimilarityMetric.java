package com.example.tutor.ragservice.store;

import java.util.List;

/**
 * Similarity metric of a collection, with its score/distance mapping pinned down.
 * Scores are always "higher is better"; distances "lower is better".
 */
public enum SimilarityMetric {

    /** score = cosine similarity in [-1, 1], distance = 1 - score. */
    COSINE("cosine") {
        @Override
        public double score(float[] query, List<Double> stored) {
            double dot = 0, nq = 0, ns = 0;
            for (int i = 0; i < query.length; i++) {
                double s = stored.get(i);
                dot += query[i] * s;
                nq += query[i] * query[i];
                ns += s * s;
            }
            return dot / (Math.sqrt(nq) * Math.sqrt(ns) + 1e-12);
        }

        @Override
        public double distance(double score) {
            return 1.0 - score;
        }

        @Override
        public double fromAtlasScore(double atlasScore) {
            return 2.0 * atlasScore - 1.0;
        }
    },

    /** score = raw dot product, distance = -score. */
    DOT_PRODUCT("dotProduct") {
        @Override
        public double score(float[] query, List<Double> stored) {
            double dot = 0;
            for (int i = 0; i < query.length; i++) {
                dot += query[i] * stored.get(i);
            }
            return dot;
        }

        @Override
        public double distance(double score) {
            return -score;
        }

        @Override
        public double fromAtlasScore(double atlasScore) {
            return 2.0 * atlasScore - 1.0;
        }
    },

    /** score = 1 / (1 + d) in (0, 1], distance = d. */
    EUCLIDEAN("euclidean") {
        @Override
        public double score(float[] query, List<Double> stored) {
            double sum = 0;
            for (int i = 0; i < query.length; i++) {
                double diff = query[i] - stored.get(i);
                sum += diff * diff;
            }
            return 1.0 / (1.0 + Math.sqrt(sum));
        }

        @Override
        public double distance(double score) {
            return score <= 0 ? Double.POSITIVE_INFINITY : 1.0 / score - 1.0;
        }

        @Override
        public double fromAtlasScore(double atlasScore) {
            return atlasScore;
        }
    };

    private final String atlasName;

    SimilarityMetric(String atlasName) {
        this.atlasName = atlasName;
    }

    /** Name of this metric in an Atlas vector index definition. */
    public String atlasName() {
        return atlasName;
    }

    public abstract double score(float[] query, List<Double> stored);

    public abstract double distance(double score);

    /** Atlas reports normalised scores in [0, 1]; converts one back to this metric's score. */
    public abstract double fromAtlasScore(double atlasScore);
}
