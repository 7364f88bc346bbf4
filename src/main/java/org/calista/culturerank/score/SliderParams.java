package org.calista.culturerank.score;

/**
 * Constants for mapping the user's diversity slider onto weights, cluster cap and exploration budget.
 */
public final class SliderParams {

    public final double deltaMax;
    public final double minWeight;
    public final double maxWeight;
    public final int maxIterations;

    /** Share of the PRS delta moved to DNS / CVS. */
    public final double dnsRatio;
    public final double cvsRatio;

    public final double effectiveKMinMultiplier;
    public final double effectiveKMaxMultiplier;

    public final double explorationMinMultiplier;
    public final double explorationMaxMultiplier;
    public final double explorationBudgetMin;
    public final double explorationBudgetMax;

    public SliderParams(double deltaMax,
                        double minWeight,
                        double maxWeight,
                        int maxIterations,
                        double dnsRatio,
                        double cvsRatio,
                        double effectiveKMinMultiplier,
                        double effectiveKMaxMultiplier,
                        double explorationMinMultiplier,
                        double explorationMaxMultiplier,
                        double explorationBudgetMin,
                        double explorationBudgetMax) {
        if (!Double.isFinite(deltaMax) || deltaMax < 0.0) throw new IllegalArgumentException("deltaMax must be finite and >= 0");
        if (!(minWeight >= 0.0 && minWeight <= maxWeight && maxWeight <= 1.0)) {
            throw new IllegalArgumentException("weight bounds must satisfy 0 <= minWeight <= maxWeight <= 1");
        }
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        if (!Double.isFinite(dnsRatio) || !Double.isFinite(cvsRatio)) throw new IllegalArgumentException("ratios must be finite");
        if (!(effectiveKMinMultiplier > 0.0 && effectiveKMinMultiplier <= effectiveKMaxMultiplier)) {
            throw new IllegalArgumentException("effectiveK multipliers must satisfy 0 < min <= max");
        }
        if (!(explorationMinMultiplier >= 0.0 && explorationMinMultiplier <= explorationMaxMultiplier)) {
            throw new IllegalArgumentException("exploration multipliers must satisfy 0 <= min <= max");
        }
        if (!(explorationBudgetMin >= 0.0 && explorationBudgetMin <= explorationBudgetMax && explorationBudgetMax <= 1.0)) {
            throw new IllegalArgumentException("exploration budget bounds must satisfy 0 <= min <= max <= 1");
        }

        this.deltaMax = deltaMax;
        this.minWeight = minWeight;
        this.maxWeight = maxWeight;
        this.maxIterations = maxIterations;
        this.dnsRatio = dnsRatio;
        this.cvsRatio = cvsRatio;
        this.effectiveKMinMultiplier = effectiveKMinMultiplier;
        this.effectiveKMaxMultiplier = effectiveKMaxMultiplier;
        this.explorationMinMultiplier = explorationMinMultiplier;
        this.explorationMaxMultiplier = explorationMaxMultiplier;
        this.explorationBudgetMin = explorationBudgetMin;
        this.explorationBudgetMax = explorationBudgetMax;
    }

    public static SliderParams defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private double deltaMax = 0.10;
        private double minWeight = 0.05;
        private double maxWeight = 0.90;
        private int maxIterations = 3;
        private double dnsRatio = 0.6;
        private double cvsRatio = 0.4;
        private double effectiveKMinMultiplier = 0.5;
        private double effectiveKMaxMultiplier = 1.5;
        private double explorationMinMultiplier = 0.5;
        private double explorationMaxMultiplier = 1.5;
        private double explorationBudgetMin = 0.0;
        private double explorationBudgetMax = 0.5;

        public Builder deltaMax(double v) { this.deltaMax = v; return this; }
        public Builder minWeight(double v) { this.minWeight = v; return this; }
        public Builder maxWeight(double v) { this.maxWeight = v; return this; }
        public Builder maxIterations(int v) { this.maxIterations = v; return this; }
        public Builder dnsRatio(double v) { this.dnsRatio = v; return this; }
        public Builder cvsRatio(double v) { this.cvsRatio = v; return this; }
        public Builder effectiveKMinMultiplier(double v) { this.effectiveKMinMultiplier = v; return this; }
        public Builder effectiveKMaxMultiplier(double v) { this.effectiveKMaxMultiplier = v; return this; }
        public Builder explorationMinMultiplier(double v) { this.explorationMinMultiplier = v; return this; }
        public Builder explorationMaxMultiplier(double v) { this.explorationMaxMultiplier = v; return this; }
        public Builder explorationBudgetMin(double v) { this.explorationBudgetMin = v; return this; }
        public Builder explorationBudgetMax(double v) { this.explorationBudgetMax = v; return this; }

        public SliderParams build() {
            return new SliderParams(deltaMax, minWeight, maxWeight, maxIterations, dnsRatio, cvsRatio,
                    effectiveKMinMultiplier, effectiveKMaxMultiplier,
                    explorationMinMultiplier, explorationMaxMultiplier,
                    explorationBudgetMin, explorationBudgetMax);
        }
    }
}
