package org.calista.culturerank.rerank;

import org.calista.culturerank.explain.ExplainThresholds;
import org.calista.culturerank.model.DiversityStrategy;
import org.calista.culturerank.model.ScoreWeights;

import java.util.Map;
import java.util.Objects;

/**
 * Inputs of one rerank call. Built once per request by the pipeline.
 */
public final class RerankOptions {

    public final int diversityCapN;
    public final int effectiveClusterCap;
    public final double effectiveExplorationBudget;
    public final double mmrSimilarityPenalty;
    public final String requestSeed;
    public final Map<String, Integer> recentClusterExposures;
    public final ExplainThresholds explainThresholds;

    /** Clusters with at most this many recent exposures feed exploration slots. */
    public final int newClusterExposureMax;

    public final DiversityStrategy strategy;
    public final DppParams dppParams;

    /** Reported back verbatim in the constraints report. */
    public final ScoreWeights effectiveWeights;

    private RerankOptions(Builder b) {
        this.diversityCapN = Math.max(0, b.diversityCapN);
        this.effectiveClusterCap = Math.max(1, b.effectiveClusterCap);
        this.effectiveExplorationBudget = b.effectiveExplorationBudget;
        this.mmrSimilarityPenalty = b.mmrSimilarityPenalty;
        this.requestSeed = b.requestSeed == null ? "" : b.requestSeed;
        this.recentClusterExposures = b.recentClusterExposures == null ? Map.of() : b.recentClusterExposures;
        this.explainThresholds = Objects.requireNonNull(b.explainThresholds, "explainThresholds");
        this.newClusterExposureMax = b.newClusterExposureMax;
        this.strategy = b.strategy == null ? DiversityStrategy.MMR : b.strategy;
        this.dppParams = Objects.requireNonNull(b.dppParams, "dppParams");
        this.effectiveWeights = Objects.requireNonNull(b.effectiveWeights, "effectiveWeights");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RerankOptions{N=" + diversityCapN + ", K=" + effectiveClusterCap + ", budget=" + effectiveExplorationBudget
                + ", lambda=" + mmrSimilarityPenalty + ", strategy=" + strategy + ", seed='" + requestSeed + "'}";
    }

    public static final class Builder {
        private int diversityCapN = 20;
        private int effectiveClusterCap = 5;
        private double effectiveExplorationBudget = 0.15;
        private double mmrSimilarityPenalty = 0.3;
        private String requestSeed = "";
        private Map<String, Integer> recentClusterExposures = Map.of();
        private ExplainThresholds explainThresholds = ExplainThresholds.DEFAULT;
        private int newClusterExposureMax = 2;
        private DiversityStrategy strategy = DiversityStrategy.MMR;
        private DppParams dppParams = DppParams.defaults();
        private ScoreWeights effectiveWeights = ScoreWeights.of(0.55, 0.25, 0.20);

        public Builder diversityCapN(int v) { this.diversityCapN = v; return this; }
        public Builder effectiveClusterCap(int v) { this.effectiveClusterCap = v; return this; }
        public Builder effectiveExplorationBudget(double v) { this.effectiveExplorationBudget = v; return this; }
        public Builder mmrSimilarityPenalty(double v) { this.mmrSimilarityPenalty = v; return this; }
        public Builder requestSeed(String v) { this.requestSeed = v; return this; }
        public Builder recentClusterExposures(Map<String, Integer> v) { this.recentClusterExposures = v; return this; }
        public Builder explainThresholds(ExplainThresholds v) { this.explainThresholds = v; return this; }
        public Builder newClusterExposureMax(int v) { this.newClusterExposureMax = v; return this; }
        public Builder strategy(DiversityStrategy v) { this.strategy = v; return this; }
        public Builder dppParams(DppParams v) { this.dppParams = v; return this; }
        public Builder effectiveWeights(ScoreWeights v) { this.effectiveWeights = v; return this; }

        public RerankOptions build() {
            return new RerankOptions(this);
        }
    }
}
