package org.calista.culturerank.rerank.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.culturerank.explain.ReasonCodeExplainer;
import org.calista.culturerank.math.Matrices;
import org.calista.culturerank.math.Numerics;
import org.calista.culturerank.model.ConstraintsReport;
import org.calista.culturerank.model.DiversityStrategy;
import org.calista.culturerank.rerank.DppParams;
import org.calista.culturerank.rerank.RerankOptions;
import org.calista.culturerank.rerank.RerankResult;
import org.calista.culturerank.rerank.RerankStrategy;
import org.calista.culturerank.rerank.SimilarityCache;
import org.calista.culturerank.score.ScoredCandidate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Greedy MAP inference for a determinantal point process over the leading candidates.
 *
 * <p>Kernel: L[i][i] = q_i^2, L[i][j] = q_i * max(0, 1 - diversityWeight * sim(i, j)) * q_j with
 * q_i = max(finalScore, 1e-10)^qualityWeight. Each step adds the candidate whose induced
 * submatrix has the largest (regularized) determinant, raised to 1/temperature.</p>
 *
 * <p>The cluster cap is not enforced here. Selections that land on a full cluster are only
 * counted in {@code capAppliedCount}. No exploration slots.</p>
 */
public final class DppReranker implements RerankStrategy {
    private static final Logger log = LogManager.getLogger(DppReranker.class);

    @Override
    public DiversityStrategy kind() {
        return DiversityStrategy.DPP;
    }

    @Override
    public RerankResult rerank(List<ScoredCandidate> ranked, RerankOptions opt) {
        int available = ranked == null ? 0 : ranked.size();
        int n = Math.min(opt.diversityCapN, available);
        if (n <= 0) {
            return RerankResult.empty(ConstraintsReport.none(opt.effectiveClusterCap, opt.effectiveExplorationBudget, opt.effectiveWeights));
        }

        DppParams p = opt.dppParams;
        int m = Math.min(p.maxKernelSize, available);
        List<ScoredCandidate> pool = ranked.subList(0, m);
        double[][] kernel = kernel(pool, p);

        ArrayList<Integer> selected = new ArrayList<>(n);
        boolean[] used = new boolean[m];
        HashMap<String, Integer> clusterCounts = new HashMap<>();
        int capApplied = 0;

        ArrayList<RerankResult.Pick> picks = new ArrayList<>(n);
        int steps = Math.min(n, m);

        for (int step = 0; step < steps; step++) {
            int best = -1;
            double bestGain = 0.0;

            int[] indices = new int[selected.size() + 1];
            for (int s = 0; s < selected.size(); s++) indices[s] = selected.get(s);

            for (int i = 0; i < m; i++) {
                if (used[i]) continue;
                indices[indices.length - 1] = i;
                double gain = gain(Matrices.determinant(Matrices.submatrix(kernel, indices), p.regularization), p.temperature);
                if (gain > bestGain) {
                    bestGain = gain;
                    best = i;
                }
            }

            if (best < 0) {
                log.debug("dpp stopped early at {} of {}: no positive gain", step, steps);
                break;
            }

            used[best] = true;
            selected.add(best);

            ScoredCandidate sc = pool.get(best);
            int count = clusterCounts.getOrDefault(sc.clusterId(), 0);
            if (count >= opt.effectiveClusterCap) capApplied++;
            clusterCounts.put(sc.clusterId(), count + 1);

            picks.add(new RerankResult.Pick(sc, ReasonCodeExplainer.explain(sc.candidate, opt.recentClusterExposures, opt.explainThresholds)));

            if (log.isTraceEnabled()) {
                log.trace("dpp step={} pick={} gain={}", step, sc.itemKey(), bestGain);
            }
        }

        ConstraintsReport report = new ConstraintsReport(
                DiversityStrategy.DPP,
                capApplied,
                0,
                0,
                opt.effectiveClusterCap,
                opt.effectiveExplorationBudget,
                opt.effectiveWeights
        );
        return new RerankResult(picks, report);
    }

    static double[][] kernel(List<ScoredCandidate> pool, DppParams p) {
        int m = pool.size();
        double[] q = new double[m];
        for (int i = 0; i < m; i++) {
            double s = Numerics.finiteOr(pool.get(i).finalScore(), 0.0);
            q[i] = Math.pow(Math.max(s, Numerics.ZERO_THRESHOLD), p.qualityWeight);
        }

        SimilarityCache sim = new SimilarityCache(pool);
        double[][] l = new double[m][m];
        for (int i = 0; i < m; i++) {
            l[i][i] = q[i] * q[i];
            for (int j = i + 1; j < m; j++) {
                double v = q[i] * Math.max(0.0, 1.0 - p.diversityWeight * sim.similarity(i, j)) * q[j];
                l[i][j] = v;
                l[j][i] = v;
            }
        }
        return l;
    }

    /** det^(1/temperature) with 0^x = 0 and non-finite results mapped to 0. */
    static double gain(double det, double temperature) {
        if (!Double.isFinite(det) || det <= 0.0) return 0.0;
        double g = temperature == 1.0 ? det : Math.pow(det, 1.0 / temperature);
        return Double.isFinite(g) && g > 0.0 ? g : 0.0;
    }
}
