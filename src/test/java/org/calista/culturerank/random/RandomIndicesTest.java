package org.calista.culturerank.random;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RandomIndicesTest {

    @Test
    void shouldMatchReferencePositions() {
        assertThat(RandomIndices.unique(XorShiftRandom.fromSeed("fixed-seed-123"), 3, 1, 9)).containsExactly(5, 6, 8);
        assertThat(RandomIndices.unique(XorShiftRandom.fromSeed("fixed-seed-123"), 6, 1, 19)).containsExactly(5, 8, 10, 11, 12, 17);
    }

    @Test
    void shouldReturnDistinctSortedIndicesWithinRange() {
        final List<Integer> picked = RandomIndices.unique(XorShiftRandom.fromSeed("req-42"), 5, 1, 19);
        assertThat(picked).hasSize(5).doesNotHaveDuplicates().isSorted().allMatch(i -> i >= 1 && i <= 19);
    }

    @Test
    void shouldReturnEveryIndexWhenCountCoversRange() {
        assertThat(RandomIndices.unique(new XorShiftRandom(1L), 4, 1, 3)).containsExactly(1, 2, 3);
        assertThat(RandomIndices.unique(new XorShiftRandom(1L), 3, 1, 3)).containsExactly(1, 2, 3);
    }

    @Test
    void shouldReturnEmptyForDegenerateRequests() {
        assertThat(RandomIndices.unique(new XorShiftRandom(1L), 0, 1, 10)).isEmpty();
        assertThat(RandomIndices.unique(new XorShiftRandom(1L), 2, 1, 0)).isEmpty();
    }
}
