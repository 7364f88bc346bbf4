package org.calista.culturerank.rerank.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.culturerank.explain.ReasonCodeExplainer;
import org.calista.culturerank.model.ConstraintsReport;
import org.calista.culturerank.model.DiversityStrategy;
import org.calista.culturerank.model.ReasonCode;
import org.calista.culturerank.model.UserState;
import org.calista.culturerank.random.RandomIndices;
import org.calista.culturerank.random.XorShiftRandom;
import org.calista.culturerank.rerank.RerankOptions;
import org.calista.culturerank.rerank.RerankResult;
import org.calista.culturerank.rerank.RerankStrategy;
import org.calista.culturerank.rerank.SimilarityCache;
import org.calista.culturerank.score.ScoredCandidate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Maximal marginal relevance with a soft per-cluster cap and seeded exploration slots.
 *
 * <p>Position 0 goes to the best-scoring candidate under the cap. Seeded positions in [1, N-1]
 * are exploration slots filled from under-exposed clusters by 0.7*DNS + 0.3*finalScore. Every
 * other position maximizes {@code finalScore - lambda * maxSimilarity(selected)}.</p>
 *
 * <p>When the cap excludes every remaining candidate the step falls back to ignoring it, so the
 * result always reaches min(N, available). Each candidate a scan passes over because of the cap
 * is counted in {@code capAppliedCount}.</p>
 */
public final class MmrReranker implements RerankStrategy {
    private static final Logger log = LogManager.getLogger(MmrReranker.class);

    static final double EXPLORATION_DNS_WEIGHT = 0.7;
    static final double EXPLORATION_SCORE_WEIGHT = 0.3;

    private static final List<ReasonCode> EXPLORATION_CODES = List.of(ReasonCode.EXPLORATION, ReasonCode.DIVERSITY_SLOT);

    @Override
    public DiversityStrategy kind() {
        return DiversityStrategy.MMR;
    }

    @Override
    public RerankResult rerank(List<ScoredCandidate> ranked, RerankOptions opt) {
        int available = ranked == null ? 0 : ranked.size();
        int n = Math.min(opt.diversityCapN, available);
        if (n <= 0) {
            return RerankResult.empty(ConstraintsReport.none(opt.effectiveClusterCap, opt.effectiveExplorationBudget, opt.effectiveWeights));
        }

        int requested = (int) Math.floor(n * opt.effectiveExplorationBudget);
        XorShiftRandom rng = XorShiftRandom.fromSeed(opt.requestSeed);
        Set<Integer> explorationPositions = new HashSet<>(RandomIndices.unique(rng, requested, 1, n - 1));

        // exploration pool, in ranking order
        ArrayList<Integer> eligible = new ArrayList<>();
        for (int i = 0; i < available; i++) {
            int exposure = UserState.exposureOf(opt.recentClusterExposures, ranked.get(i).clusterId());
            if (exposure <= opt.newClusterExposureMax) eligible.add(i);
        }

        Step step = new Step(ranked, opt, available);
        ArrayList<RerankResult.Pick> picks = new ArrayList<>(n);
        int filled = 0;

        for (int pos = 0; pos < n && step.remaining() > 0; pos++) {
            int idx;
            boolean exploration = explorationPositions.contains(pos);

            if (exploration) {
                idx = step.pickExploration(eligible);
            } else if (pos == 0) {
                idx = step.pickTop();
            } else {
                idx = step.pickMmr();
            }
            if (idx < 0) break;

            step.take(idx);
            ScoredCandidate sc = ranked.get(idx);
            List<ReasonCode> codes = ReasonCodeExplainer.explain(sc.candidate, opt.recentClusterExposures, opt.explainThresholds);
            if (exploration) {
                codes = ReasonCodeExplainer.merge(EXPLORATION_CODES, codes);
                filled++;
            }
            picks.add(new RerankResult.Pick(sc, codes));

            if (log.isTraceEnabled()) {
                log.trace("mmr pos={} pick={} cluster={} exploration={}", pos, sc.itemKey(), sc.clusterId(), exploration);
            }
        }

        ConstraintsReport report = new ConstraintsReport(
                DiversityStrategy.MMR,
                step.capApplied,
                requested,
                filled,
                opt.effectiveClusterCap,
                opt.effectiveExplorationBudget,
                opt.effectiveWeights
        );
        return new RerankResult(picks, report);
    }

    static double explorationScore(ScoredCandidate sc) {
        return EXPLORATION_DNS_WEIGHT * sc.score.dns + EXPLORATION_SCORE_WEIGHT * sc.finalScore();
    }

    // ---------------------------------------------------------------------
    // per-call selection state
    // ---------------------------------------------------------------------

    private static final class Step {
        private final List<ScoredCandidate> ranked;
        private final RerankOptions opt;
        private final boolean[] used;
        private final HashMap<String, Integer> clusterCounts = new HashMap<>();
        private final ArrayList<Integer> selected = new ArrayList<>();
        private final SimilarityCache similarity;
        private int left;
        int capApplied;

        Step(List<ScoredCandidate> ranked, RerankOptions opt, int available) {
            this.ranked = ranked;
            this.opt = opt;
            this.used = new boolean[available];
            this.similarity = new SimilarityCache(ranked);
            this.left = available;
        }

        int remaining() {
            return left;
        }

        boolean underCap(int idx) {
            return clusterCounts.getOrDefault(ranked.get(idx).clusterId(), 0) < opt.effectiveClusterCap;
        }

        void take(int idx) {
            used[idx] = true;
            left--;
            selected.add(idx);
            clusterCounts.merge(ranked.get(idx).clusterId(), 1, Integer::sum);
        }

        int pickTop() {
            int fallback = -1;
            for (int i = 0; i < used.length; i++) {
                if (used[i]) continue;
                if (underCap(i)) return i;
                capApplied++;
                if (fallback < 0) fallback = i;
            }
            return fallback;
        }

        int pickExploration(List<Integer> eligible) {
            int best = -1;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int i : eligible) {
                if (used[i]) continue;
                if (!underCap(i)) {
                    capApplied++;
                    continue;
                }
                double s = explorationScore(ranked.get(i));
                if (s > bestScore) {
                    bestScore = s;
                    best = i;
                }
            }
            if (best >= 0) return best;

            // nothing eligible under the cap: widen to the whole remaining pool, cap first
            int capped = -1;
            double cappedScore = Double.NEGATIVE_INFINITY;
            int any = -1;
            double anyScore = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < used.length; i++) {
                if (used[i]) continue;
                double s = explorationScore(ranked.get(i));
                if (underCap(i) && s > cappedScore) {
                    cappedScore = s;
                    capped = i;
                }
                if (s > anyScore) {
                    anyScore = s;
                    any = i;
                }
            }
            return capped >= 0 ? capped : any;
        }

        int pickMmr() {
            int best = -1;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < used.length; i++) {
                if (used[i]) continue;
                if (!underCap(i)) {
                    capApplied++;
                    continue;
                }
                double s = mmrScore(i);
                if (s > bestScore) {
                    bestScore = s;
                    best = i;
                }
            }
            if (best >= 0) return best;

            for (int i = 0; i < used.length; i++) {
                if (used[i]) continue;
                double s = mmrScore(i);
                if (s > bestScore) {
                    bestScore = s;
                    best = i;
                }
            }
            return best;
        }

        private double mmrScore(int i) {
            double s = ranked.get(i).finalScore() - opt.mmrSimilarityPenalty * similarity.maxSimilarity(i, selected);
            return Double.isFinite(s) ? s : -Double.MAX_VALUE;
        }
    }
}
