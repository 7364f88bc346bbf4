package org.calista.culturerank.rerank;

import org.calista.culturerank.math.Matrices;

/**
 * Kernel and sampling knobs for {@link org.calista.culturerank.rerank.impl.DppReranker}.
 */
public final class DppParams {

    public final double qualityWeight;
    public final double diversityWeight;
    public final double temperature;
    public final double regularization;

    /** Kernel is built over at most this many leading candidates; larger N is served by MMR. */
    public final int maxKernelSize;

    public DppParams(double qualityWeight, double diversityWeight, double temperature, double regularization, int maxKernelSize) {
        if (!(qualityWeight > 0.0) || !Double.isFinite(qualityWeight)) throw new IllegalArgumentException("qualityWeight must be > 0");
        if (!(diversityWeight >= 0.0) || diversityWeight > 1.0) throw new IllegalArgumentException("diversityWeight must be in [0..1]");
        if (!(temperature > 0.0) || !Double.isFinite(temperature)) throw new IllegalArgumentException("temperature must be > 0");
        if (!(regularization >= 0.0) || !Double.isFinite(regularization)) throw new IllegalArgumentException("regularization must be >= 0");
        if (maxKernelSize <= 0) throw new IllegalArgumentException("maxKernelSize must be > 0");

        this.qualityWeight = qualityWeight;
        this.diversityWeight = diversityWeight;
        this.temperature = temperature;
        this.regularization = regularization;
        this.maxKernelSize = maxKernelSize;
    }

    public static DppParams defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "DppParams{quality=" + qualityWeight + ", diversity=" + diversityWeight + ", temperature=" + temperature
                + ", reg=" + regularization + ", maxKernel=" + maxKernelSize + '}';
    }

    public static final class Builder {
        private double qualityWeight = 1.0;
        private double diversityWeight = 0.7;
        private double temperature = 1.0;
        private double regularization = Matrices.DEFAULT_REGULARIZATION;
        private int maxKernelSize = 100;

        public Builder qualityWeight(double v) { this.qualityWeight = v; return this; }
        public Builder diversityWeight(double v) { this.diversityWeight = v; return this; }
        public Builder temperature(double v) { this.temperature = v; return this; }
        public Builder regularization(double v) { this.regularization = v; return this; }
        public Builder maxKernelSize(int v) { this.maxKernelSize = v; return this; }

        public DppParams build() {
            return new DppParams(qualityWeight, diversityWeight, temperature, regularization, maxKernelSize);
        }
    }
}
