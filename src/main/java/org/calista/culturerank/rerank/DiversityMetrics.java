package org.calista.culturerank.rerank;

import org.calista.culturerank.math.Numerics;
import org.calista.culturerank.score.ScoredCandidate;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Diversity summary of a ranked list. Diagnostic only; never feeds back into ranking.
 *
 * @param clusterEntropy     Shannon entropy of the cluster distribution, in bits
 * @param avgPairwiseDistance mean of (1 - rerank similarity) over all pairs, 0 below two items
 * @param uniqueClusters     number of distinct clusters
 * @param maxClusterRatio    share of the largest cluster, 0 for an empty list
 */
public record DiversityMetrics(double clusterEntropy, double avgPairwiseDistance, int uniqueClusters, double maxClusterRatio) {

    public static final DiversityMetrics EMPTY = new DiversityMetrics(0.0, 0.0, 0, 0.0);

    public static DiversityMetrics of(List<ScoredCandidate> items) {
        if (items == null || items.isEmpty()) return EMPTY;

        TreeMap<String, Integer> counts = new TreeMap<>();
        for (ScoredCandidate sc : items) counts.merge(sc.clusterId(), 1, Integer::sum);

        int total = items.size();
        double entropy = 0.0;
        int max = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            int c = e.getValue();
            max = Math.max(max, c);
            double p = (double) c / total;
            entropy -= p * (Math.log(p) / Numerics.LN2);
        }

        double distance = 0.0;
        if (total >= 2) {
            SimilarityCache sim = new SimilarityCache(items);
            double sum = 0.0;
            long pairs = 0;
            for (int i = 0; i < total; i++) {
                for (int j = i + 1; j < total; j++) {
                    sum += 1.0 - sim.similarity(i, j);
                    pairs++;
                }
            }
            distance = sum / pairs;
        }

        return new DiversityMetrics(Math.max(0.0, entropy), distance, counts.size(), (double) max / total);
    }
}
