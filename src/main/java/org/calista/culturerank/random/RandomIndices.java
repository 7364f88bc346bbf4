package org.calista.culturerank.random;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

public final class RandomIndices {

    private RandomIndices() {}

    /**
     * Picks {@code count} distinct indices in [min, max] and returns them ascending.
     * When the range holds no more than {@code count} values every index in it is returned.
     */
    public static List<Integer> unique(XorShiftRandom rng, int count, int min, int max) {
        if (count <= 0 || max < min) return List.of();

        int range = max - min + 1;
        if (count >= range) {
            ArrayList<Integer> all = new ArrayList<>(range);
            for (int i = min; i <= max; i++) all.add(i);
            return all;
        }

        TreeSet<Integer> picked = new TreeSet<>();
        while (picked.size() < count) {
            picked.add(rng.nextInt(min, max));
        }
        return new ArrayList<>(picked);
    }
}
