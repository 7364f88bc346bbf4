package org.calista.culturerank.math;

/**
 * Dense square-matrix helpers for the DPP kernel.
 */
public final class Matrices {

    public static final double DEFAULT_REGULARIZATION = 1e-6;

    private Matrices() {}

    public static double determinant(double[][] m) {
        return determinant(m, DEFAULT_REGULARIZATION);
    }

    /**
     * Determinant of {@code m + regularization * I} via partially pivoted LU.
     * The input is not modified. A pivot below {@link Numerics#ZERO_THRESHOLD} yields 0.
     */
    public static double determinant(double[][] m, double regularization) {
        int n = m == null ? 0 : m.length;
        if (n == 0) return 1.0;
        if (n == 1) return m[0][0] + regularization;
        if (n == 2) {
            double a = m[0][0] + regularization;
            double d = m[1][1] + regularization;
            return a * d - m[0][1] * m[1][0];
        }

        double[][] lu = new double[n][];
        for (int i = 0; i < n; i++) {
            lu[i] = m[i].clone();
            lu[i][i] += regularization;
        }

        double det = 1.0;
        int swaps = 0;

        for (int i = 0; i < n; i++) {
            int maxRow = i;
            double maxVal = Math.abs(lu[i][i]);
            for (int k = i + 1; k < n; k++) {
                double v = Math.abs(lu[k][i]);
                if (v > maxVal) {
                    maxVal = v;
                    maxRow = k;
                }
            }

            if (maxRow != i) {
                double[] tmp = lu[i];
                lu[i] = lu[maxRow];
                lu[maxRow] = tmp;
                swaps++;
            }

            double pivot = lu[i][i];
            if (!(Math.abs(pivot) >= Numerics.ZERO_THRESHOLD)) return 0.0;

            det *= pivot;

            for (int k = i + 1; k < n; k++) {
                double f = lu[k][i] / pivot;
                for (int j = i + 1; j < n; j++) {
                    lu[k][j] -= f * lu[i][j];
                }
                lu[k][i] = 0.0;
            }
        }

        return (swaps % 2 == 0) ? det : -det;
    }

    /**
     * Principal submatrix on {@code indices}. Out-of-range indices and non-finite entries read as 0.
     */
    public static double[][] submatrix(double[][] m, int[] indices) {
        int k = indices.length;
        double[][] out = new double[k][k];
        for (int a = 0; a < k; a++) {
            int i = indices[a];
            if (i < 0 || i >= m.length || m[i] == null) continue;
            for (int b = 0; b < k; b++) {
                int j = indices[b];
                if (j < 0 || j >= m[i].length) continue;
                double v = m[i][j];
                out[a][b] = Double.isFinite(v) ? v : 0.0;
            }
        }
        return out;
    }
}
