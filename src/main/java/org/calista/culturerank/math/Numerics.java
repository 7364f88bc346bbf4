package org.calista.culturerank.math;

/**
 * Numeric guards shared by scoring and reranking.
 *
 * Every helper resolves NaN/Infinity to a finite value: a degraded but well-formed
 * ranking is preferred over an exception in the serving path.
 */
public final class Numerics {

    public static final double LN2 = Math.log(2.0);

    /** Pivots and norms below this are treated as zero. */
    public static final double ZERO_THRESHOLD = 1e-10;

    private Numerics() {}

    public static double clamp(double v, double min, double max) {
        double lo = Double.isFinite(min) ? min : 0.0;
        double hi = Double.isFinite(max) ? max : lo;
        if (lo > hi) {
            double t = lo;
            lo = hi;
            hi = t;
        }
        if (!Double.isFinite(v)) {
            if (v == Double.POSITIVE_INFINITY) return hi;
            return lo;
        }
        return Math.max(lo, Math.min(hi, v));
    }

    public static double clamp01(double v) {
        return clamp(v, 0.0, 1.0);
    }

    public static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    /** Rounds to 9 decimal digits. Scores are compared across implementations within 1e-9. */
    public static double round9(double v) {
        if (!Double.isFinite(v)) return 0.0;
        return Math.round(v * 1e9) / 1e9;
    }

    public static double safeDiv(double a, double b, double fallback) {
        double fb = Double.isFinite(fallback) ? fallback : 0.0;
        if (!Double.isFinite(a) || !Double.isFinite(b) || b == 0.0) return fb;
        double r = a / b;
        return Double.isFinite(r) ? r : fb;
    }

    public static double lerp(double a, double b, double t) {
        return a + (b - a) * t;
    }

    public static double finiteOr(double v, double fallback) {
        return Double.isFinite(v) ? v : fallback;
    }
}
