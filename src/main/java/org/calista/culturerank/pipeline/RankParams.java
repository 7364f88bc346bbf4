package org.calista.culturerank.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.culturerank.explain.ExplainThresholds;
import org.calista.culturerank.math.Numerics;
import org.calista.culturerank.model.DiversityStrategy;
import org.calista.culturerank.model.ParamOverrides;
import org.calista.culturerank.model.ScoreWeights;
import org.calista.culturerank.rerank.DppParams;
import org.calista.culturerank.score.ScoringParams;
import org.calista.culturerank.score.SliderParams;

import java.util.Objects;

/**
 * Effective parameters of a ranking call: configured defaults with request overrides applied.
 *
 * <p>Immutable. Its Jackson form (public fields) is what the parameter fingerprint hashes, so
 * every field that can change the output belongs here.</p>
 */
public final class RankParams {
    private static final Logger log = LogManager.getLogger(RankParams.class);

    public static final ScoreWeights DEFAULT_WEIGHTS = ScoreWeights.of(0.55, 0.25, 0.20);

    public final ScoreWeights weights;
    public final int diversityCapN;
    public final int diversityCapK;
    public final double explorationBudget;
    public final double mmrSimilarityPenalty;
    public final int rerankMaxCandidates;
    public final DiversityStrategy rerankStrategy;
    public final int newClusterExposureMax;

    public final ScoringParams scoring;
    public final SliderParams slider;
    public final DppParams dpp;
    public final ExplainThresholds explain;

    private RankParams(Builder b) {
        this.weights = Objects.requireNonNull(b.weights, "weights");
        this.diversityCapN = Math.max(0, b.diversityCapN);
        this.diversityCapK = Math.max(1, b.diversityCapK);
        this.explorationBudget = Numerics.clamp01(b.explorationBudget);
        this.mmrSimilarityPenalty = Numerics.finiteOr(b.mmrSimilarityPenalty, 0.3);
        this.rerankMaxCandidates = Math.max(1, b.rerankMaxCandidates);
        this.rerankStrategy = b.rerankStrategy == null ? DiversityStrategy.MMR : b.rerankStrategy;
        this.newClusterExposureMax = Math.max(0, b.newClusterExposureMax);
        this.scoring = Objects.requireNonNull(b.scoring, "scoring");
        this.slider = Objects.requireNonNull(b.slider, "slider");
        this.dpp = Objects.requireNonNull(b.dpp, "dpp");
        this.explain = Objects.requireNonNull(b.explain, "explain");
    }

    public static RankParams defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .weights(weights)
                .diversityCapN(diversityCapN)
                .diversityCapK(diversityCapK)
                .explorationBudget(explorationBudget)
                .mmrSimilarityPenalty(mmrSimilarityPenalty)
                .rerankMaxCandidates(rerankMaxCandidates)
                .rerankStrategy(rerankStrategy)
                .newClusterExposureMax(newClusterExposureMax)
                .scoring(scoring)
                .slider(slider)
                .dpp(dpp)
                .explain(explain);
    }

    /**
     * Applies per-request overrides. Out-of-range values are clamped (N >= 0, K >= 1, budget in
     * [0..1], max candidates >= 1); non-finite numbers and non-finite weights are ignored.
     */
    public RankParams withOverrides(ParamOverrides o) {
        if (o == null) return this;
        Builder b = toBuilder();

        if (o.diversityCapN != null) b.diversityCapN(o.diversityCapN);
        if (o.diversityCapK != null) b.diversityCapK(o.diversityCapK);
        if (o.explorationBudget != null && Double.isFinite(o.explorationBudget)) b.explorationBudget(o.explorationBudget);
        if (o.mmrSimilarityPenalty != null && Double.isFinite(o.mmrSimilarityPenalty)) b.mmrSimilarityPenalty(o.mmrSimilarityPenalty);
        if (o.rerankMaxCandidates != null) b.rerankMaxCandidates(o.rerankMaxCandidates);
        if (o.rerankStrategy != null) b.rerankStrategy(o.rerankStrategy);

        if (o.weights != null) {
            if (Double.isFinite(o.weights.sum())) {
                b.weights(o.weights);
            } else {
                log.warn("Ignoring non-finite weight override {}", o.weights);
            }
        }
        return b.build();
    }

    @Override
    public String toString() {
        return "RankParams{weights=" + weights + ", N=" + diversityCapN + ", K=" + diversityCapK
                + ", budget=" + explorationBudget + ", lambda=" + mmrSimilarityPenalty
                + ", maxCandidates=" + rerankMaxCandidates + ", strategy=" + rerankStrategy + '}';
    }

    public static final class Builder {
        private ScoreWeights weights = DEFAULT_WEIGHTS;
        private int diversityCapN = 20;
        private int diversityCapK = 5;
        private double explorationBudget = 0.15;
        private double mmrSimilarityPenalty = 0.3;
        private int rerankMaxCandidates = 200;
        private DiversityStrategy rerankStrategy = DiversityStrategy.MMR;
        private int newClusterExposureMax = 2;
        private ScoringParams scoring = ScoringParams.defaults();
        private SliderParams slider = SliderParams.defaults();
        private DppParams dpp = DppParams.defaults();
        private ExplainThresholds explain = ExplainThresholds.DEFAULT;

        public Builder weights(ScoreWeights v) { this.weights = v; return this; }
        public Builder diversityCapN(int v) { this.diversityCapN = v; return this; }
        public Builder diversityCapK(int v) { this.diversityCapK = v; return this; }
        public Builder explorationBudget(double v) { this.explorationBudget = v; return this; }
        public Builder mmrSimilarityPenalty(double v) { this.mmrSimilarityPenalty = v; return this; }
        public Builder rerankMaxCandidates(int v) { this.rerankMaxCandidates = v; return this; }
        public Builder rerankStrategy(DiversityStrategy v) { this.rerankStrategy = v; return this; }
        public Builder newClusterExposureMax(int v) { this.newClusterExposureMax = v; return this; }
        public Builder scoring(ScoringParams v) { this.scoring = v; return this; }
        public Builder slider(SliderParams v) { this.slider = v; return this; }
        public Builder dpp(DppParams v) { this.dpp = v; return this; }
        public Builder explain(ExplainThresholds v) { this.explain = v; return this; }

        public RankParams build() {
            return new RankParams(this);
        }
    }
}
