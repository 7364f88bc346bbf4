package org.calista.culturerank.score;

import java.util.Objects;

/**
 * Scoring constants. Immutable; built once per process from {@code RankConfig}.
 */
public final class ScoringParams {

    public final CvsWeights cvsWeights;
    public final double clusterNoveltyFactor;
    public final double timeHalfLifeHours;
    public final double dnsClusterNoveltyWeight;
    public final double dnsTimeNoveltyWeight;
    public final double spamPenalty;

    public ScoringParams(CvsWeights cvsWeights,
                         double clusterNoveltyFactor,
                         double timeHalfLifeHours,
                         double dnsClusterNoveltyWeight,
                         double dnsTimeNoveltyWeight,
                         double spamPenalty) {
        this.cvsWeights = Objects.requireNonNull(cvsWeights, "cvsWeights");
        if (!Double.isFinite(clusterNoveltyFactor) || clusterNoveltyFactor < 0.0) {
            throw new IllegalArgumentException("clusterNoveltyFactor must be finite and >= 0");
        }
        if (!Double.isFinite(timeHalfLifeHours)) throw new IllegalArgumentException("timeHalfLifeHours must be finite");
        if (!Double.isFinite(dnsClusterNoveltyWeight) || !Double.isFinite(dnsTimeNoveltyWeight)) {
            throw new IllegalArgumentException("dns weights must be finite");
        }
        if (!(spamPenalty >= 0.0 && spamPenalty <= 1.0)) throw new IllegalArgumentException("spamPenalty must be in [0..1]");

        this.clusterNoveltyFactor = clusterNoveltyFactor;
        this.timeHalfLifeHours = timeHalfLifeHours;
        this.dnsClusterNoveltyWeight = dnsClusterNoveltyWeight;
        this.dnsTimeNoveltyWeight = dnsTimeNoveltyWeight;
        this.spamPenalty = spamPenalty;
    }

    public static ScoringParams defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CvsWeights cvsWeights = CvsWeights.DEFAULT;
        private double clusterNoveltyFactor = 0.06;
        private double timeHalfLifeHours = 72.0;
        private double dnsClusterNoveltyWeight = 0.6;
        private double dnsTimeNoveltyWeight = 0.4;
        private double spamPenalty = 0.5;

        public Builder cvsWeights(CvsWeights v) { this.cvsWeights = v; return this; }
        public Builder clusterNoveltyFactor(double v) { this.clusterNoveltyFactor = v; return this; }
        public Builder timeHalfLifeHours(double v) { this.timeHalfLifeHours = v; return this; }
        public Builder dnsClusterNoveltyWeight(double v) { this.dnsClusterNoveltyWeight = v; return this; }
        public Builder dnsTimeNoveltyWeight(double v) { this.dnsTimeNoveltyWeight = v; return this; }
        public Builder spamPenalty(double v) { this.spamPenalty = v; return this; }

        public ScoringParams build() {
            return new ScoringParams(cvsWeights, clusterNoveltyFactor, timeHalfLifeHours,
                    dnsClusterNoveltyWeight, dnsTimeNoveltyWeight, spamPenalty);
        }
    }
}
