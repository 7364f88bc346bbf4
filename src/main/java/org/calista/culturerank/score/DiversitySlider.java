package org.calista.culturerank.score;

import org.calista.culturerank.math.Numerics;
import org.calista.culturerank.model.ScoreWeights;

import java.util.Objects;

/**
 * Maps a diversity preference t in [0..1] onto renormalized score weights, an effective cluster
 * cap and an effective exploration budget. Pure; no randomness.
 *
 * <p>t = 0.5 is neutral. Higher t moves weight from PRS to DNS/CVS, lowers the cluster cap and
 * raises the exploration budget.</p>
 */
public final class DiversitySlider {

    private final SliderParams params;

    public DiversitySlider(SliderParams params) {
        this.params = Objects.requireNonNull(params, "params");
    }

    public Result apply(ScoreWeights base, double slider, int baseClusterCap, double baseExplorationBudget) {
        Objects.requireNonNull(base, "base");
        double t = Double.isNaN(slider) ? 0.5 : Numerics.clamp01(slider);

        ScoreWeights weights = adjustWeights(base, t);
        int k = effectiveClusterCap(baseClusterCap, t);
        double budget = effectiveExplorationBudget(baseExplorationBudget, t);

        return new Result(t, weights, k, budget);
    }

    public ScoreWeights adjustWeights(ScoreWeights base, double t) {
        double delta = (2.0 * t - 1.0) * params.deltaMax;

        double prs = base.prs - delta;
        double dns = base.dns + params.dnsRatio * delta;
        double cvs = base.cvs + params.cvsRatio * delta;

        for (int pass = 0; pass < params.maxIterations; pass++) {
            prs = Numerics.clamp(prs, params.minWeight, params.maxWeight);
            cvs = Numerics.clamp(cvs, params.minWeight, params.maxWeight);
            dns = Numerics.clamp(dns, params.minWeight, params.maxWeight);

            double sum = prs + cvs + dns;
            if (!(sum > 0.0) || !Double.isFinite(sum)) {
                return ScoreWeights.of(1.0 / 3.0, 1.0 / 3.0, 1.0 / 3.0);
            }
            prs /= sum;
            cvs /= sum;
            dns /= sum;

            if (within(prs) && within(cvs) && within(dns)) break;
        }

        return ScoreWeights.of(prs, cvs, dns);
    }

    public int effectiveClusterCap(int baseClusterCap, double t) {
        int k = Math.max(1, baseClusterCap);
        double mult = Numerics.lerp(params.effectiveKMaxMultiplier, params.effectiveKMinMultiplier, t);
        long raw = Math.round(k * mult);
        return (int) Math.max(1L, Math.min((long) k + 3L, raw));
    }

    public double effectiveExplorationBudget(double baseBudget, double t) {
        double base = Numerics.finiteOr(baseBudget, 0.0);
        double mult = Numerics.lerp(params.explorationMinMultiplier, params.explorationMaxMultiplier, t);
        return Numerics.clamp(base * mult, params.explorationBudgetMin, params.explorationBudgetMax);
    }

    private boolean within(double w) {
        return w >= params.minWeight && w <= params.maxWeight;
    }

    /**
     * Slider outcome for one call.
     */
    public static final class Result {
        public final double slider;
        public final ScoreWeights weights;
        public final int effectiveClusterCap;
        public final double effectiveExplorationBudget;

        Result(double slider, ScoreWeights weights, int effectiveClusterCap, double effectiveExplorationBudget) {
            this.slider = slider;
            this.weights = weights;
            this.effectiveClusterCap = effectiveClusterCap;
            this.effectiveExplorationBudget = effectiveExplorationBudget;
        }
    }
}
