package org.calista.culturerank.math;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Vector and set similarity measures.
 *
 * Mismatched or empty inputs never throw: cosine/jaccard/euclidean similarity resolve to 0.
 */
public final class Similarity {

    private Similarity() {}

    /** Cosine similarity in [-1, 1]; 0 for null, empty, mismatched or zero-norm vectors. */
    public static double cosine(double[] a, double[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) return 0.0;

        double dot = 0.0, na = 0.0, nb = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }

        double den = Math.sqrt(na) * Math.sqrt(nb);
        if (!(den >= Numerics.ZERO_THRESHOLD)) return 0.0;

        double c = dot / den;
        return Double.isFinite(c) ? Numerics.clamp(c, -1.0, 1.0) : 0.0;
    }

    /** Euclidean distance; +Infinity for mismatched or empty vectors. */
    public static double euclideanDistance(double[] a, double[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) return Double.POSITIVE_INFINITY;

        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /** 1 / (1 + distance), in (0, 1]; 0 for mismatched vectors. */
    public static double euclidean(double[] a, double[] b) {
        double d = euclideanDistance(a, b);
        if (!Double.isFinite(d)) return 0.0;
        return 1.0 / (1.0 + Math.max(0.0, d));
    }

    /**
     * Jaccard over feature keys whose value is at least {@code threshold}.
     */
    public static double jaccard(Map<String, Double> a, Map<String, Double> b, double threshold) {
        if (a == null || b == null) return 0.0;

        Set<String> sa = activeKeys(a, threshold);
        Set<String> sb = activeKeys(b, threshold);

        int inter = 0;
        for (String k : sa) if (sb.contains(k)) inter++;
        int union = sa.size() + sb.size() - inter;
        return union <= 0 ? 0.0 : (double) inter / (double) union;
    }

    public static double cluster(String a, String b) {
        return Objects.equals(a, b) ? 1.0 : 0.0;
    }

    private static Set<String> activeKeys(Map<String, Double> m, double threshold) {
        HashSet<String> out = new HashSet<>(Math.max(4, m.size() * 2));
        for (Map.Entry<String, Double> e : m.entrySet()) {
            Double v = e.getValue();
            if (v != null && v >= threshold) out.add(e.getKey());
        }
        return out;
    }
}
