package org.calista.culturerank.rerank;

import org.calista.culturerank.math.Similarity;
import org.calista.culturerank.model.Candidate;
import org.calista.culturerank.score.ScoredCandidate;

import java.util.HashMap;
import java.util.List;
import java.util.Objects;

/**
 * Pairwise rerank similarity over one candidate list, keyed by the unordered index pair.
 *
 * Lives for exactly one rerank call; not thread-safe.
 */
public final class SimilarityCache {

    private final List<ScoredCandidate> items;
    private final HashMap<Long, Double> cache;

    public SimilarityCache(List<ScoredCandidate> items) {
        this.items = Objects.requireNonNull(items, "items");
        this.cache = new HashMap<>(Math.max(16, items.size() * 4));
    }

    public double similarity(int i, int j) {
        if (i == j) return 1.0;
        int lo = Math.min(i, j);
        int hi = Math.max(i, j);
        long key = ((long) lo << 32) | (hi & 0xFFFFFFFFL);
        return cache.computeIfAbsent(key, k -> between(items.get(lo).candidate, items.get(hi).candidate));
    }

    /** Highest similarity between {@code i} and any of {@code selected}; 0 when nothing is selected. */
    public double maxSimilarity(int i, List<Integer> selected) {
        double max = 0.0;
        for (int j : selected) {
            double s = similarity(i, j);
            if (s > max) max = s;
        }
        return max;
    }

    public int size() {
        return cache.size();
    }

    /**
     * Similarity in [0..1]: (cosine + 1) / 2 when both carry an embedding, else 1 for the same
     * cluster and 0 otherwise.
     */
    public static double between(Candidate a, Candidate b) {
        if (a.features != null && b.features != null && a.features.hasEmbedding() && b.features.hasEmbedding()) {
            return (Similarity.cosine(a.features.embedding, b.features.embedding) + 1.0) / 2.0;
        }
        return Similarity.cluster(a.clusterId, b.clusterId);
    }
}
