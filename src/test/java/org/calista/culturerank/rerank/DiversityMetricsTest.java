package org.calista.culturerank.rerank;

import org.calista.culturerank.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DiversityMetricsTest {

    @Test
    void shouldGiveOneBitOfEntropyForEvenSpreadOverTwoClusters() {
        final DiversityMetrics m = DiversityMetrics.of(List.of(
                Fixtures.scored("a", "c1", 0.5, 0.5),
                Fixtures.scored("b", "c2", 0.5, 0.5),
                Fixtures.scored("c", "c1", 0.5, 0.5),
                Fixtures.scored("d", "c2", 0.5, 0.5)));

        assertThat(m.clusterEntropy()).isCloseTo(1.0, within(1e-12));
        assertThat(m.uniqueClusters()).isEqualTo(2);
        assertThat(m.maxClusterRatio()).isEqualTo(0.5);
        // 4 of 6 pairs cross clusters
        assertThat(m.avgPairwiseDistance()).isCloseTo(4.0 / 6.0, within(1e-12));
    }

    @Test
    void shouldGiveNoEntropyForSingleCluster() {
        final DiversityMetrics m = DiversityMetrics.of(List.of(
                Fixtures.scored("a", "c1", 0.5, 0.5),
                Fixtures.scored("b", "c1", 0.5, 0.5)));

        assertThat(m.clusterEntropy()).isEqualTo(0.0);
        assertThat(m.maxClusterRatio()).isEqualTo(1.0);
        assertThat(m.avgPairwiseDistance()).isEqualTo(0.0);
    }

    @Test
    void shouldGiveEmptyMetricsForEmptyList() {
        assertThat(DiversityMetrics.of(List.of())).isEqualTo(DiversityMetrics.EMPTY);
    }
}
