package org.calista.culturerank.score;

/**
 * Weights of the cultural-value sub-signals. Defaults sum to 1.0.
 */
public final class CvsWeights {
    public final double like;
    public final double context;
    public final double collection;
    public final double bridge;
    public final double sustain;

    public static final CvsWeights DEFAULT = new CvsWeights(0.35, 0.25, 0.15, 0.15, 0.10);

    public CvsWeights(double like, double context, double collection, double bridge, double sustain) {
        if (!Double.isFinite(like) || !Double.isFinite(context) || !Double.isFinite(collection)
                || !Double.isFinite(bridge) || !Double.isFinite(sustain)) {
            throw new IllegalArgumentException("cvs weights must be finite");
        }
        this.like = like;
        this.context = context;
        this.collection = collection;
        this.bridge = bridge;
        this.sustain = sustain;
    }
}
