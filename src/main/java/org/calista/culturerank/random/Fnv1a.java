package org.calista.culturerank.random;

import java.nio.charset.StandardCharsets;

/**
 * 64-bit FNV-1a over UTF-8 bytes. Arithmetic wraps at 64 bits, as Java long multiplication does.
 */
public final class Fnv1a {

    public static final long OFFSET_BASIS = 0xcbf29ce484222325L;
    public static final long PRIME = 0x100000001b3L;

    private Fnv1a() {}

    public static long hash64(String s) {
        return hash64(s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8));
    }

    public static long hash64(byte[] bytes) {
        long h = OFFSET_BASIS;
        for (byte b : bytes) {
            h ^= (b & 0xFFL);
            h *= PRIME;
        }
        return h;
    }

    /** Seed for {@link XorShiftRandom}; a zero hash is forced to 1 because xorshift never leaves 0. */
    public static long seedOf(String seed) {
        long h = hash64(seed);
        return h == 0L ? 1L : h;
    }

    public static String hex64(long h) {
        String s = Long.toHexString(h);
        if (s.length() >= 16) return s;
        return "0".repeat(16 - s.length()) + s;
    }
}
