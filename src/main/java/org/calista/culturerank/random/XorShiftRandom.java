package org.calista.culturerank.random;

/**
 * xorshift64 generator (13, 7, 17).
 *
 * Not thread-safe; one instance lives for exactly one rerank call.
 * Output sequence is bit-identical for identical seeds on every platform.
 */
public final class XorShiftRandom {

    private static final double TWO_POW_32 = 4294967296.0;
    private static final double BELOW_ONE = Math.nextDown(1.0);

    private long state;

    public XorShiftRandom(long seed) {
        this.state = seed == 0L ? 1L : seed;
    }

    public static XorShiftRandom fromSeed(String seed) {
        return new XorShiftRandom(Fnv1a.seedOf(seed));
    }

    public long nextLong() {
        long x = state;
        x ^= x << 13;
        x ^= x >>> 7;
        x ^= x << 17;
        if (x == 0L) x = 1L;
        state = x;
        return x;
    }

    /** Uniform double in [0, 1) taken from the low 32 bits of the next state. */
    public double nextDouble() {
        double v = (nextLong() & 0xFFFFFFFFL) / TWO_POW_32;
        if (v < 0.0) return 0.0;
        return v >= 1.0 ? BELOW_ONE : v;
    }

    /** Uniform int in [min, max], both inclusive. */
    public int nextInt(int min, int max) {
        if (max <= min) return min;
        long span = (long) max - (long) min + 1L;
        long off = (long) Math.floor(nextDouble() * span);
        if (off >= span) off = span - 1;
        return (int) (min + off);
    }

    long state() {
        return state;
    }
}
