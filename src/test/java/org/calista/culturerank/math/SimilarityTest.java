package org.calista.culturerank.math;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityTest {

    @Test
    void shouldGiveUnitCosineForParallelAndOppositeVectors() {
        assertThat(Similarity.cosine(new double[]{1, 2, 3}, new double[]{2, 4, 6})).isCloseTo(1.0, within(1e-12));
        assertThat(Similarity.cosine(new double[]{1, 0}, new double[]{-1, 0})).isCloseTo(-1.0, within(1e-12));
        assertThat(Similarity.cosine(new double[]{1, 0}, new double[]{0, 1})).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void shouldGiveZeroCosineForDegenerateInput() {
        assertThat(Similarity.cosine(null, new double[]{1})).isEqualTo(0.0);
        assertThat(Similarity.cosine(new double[]{}, new double[]{})).isEqualTo(0.0);
        assertThat(Similarity.cosine(new double[]{1, 2}, new double[]{1, 2, 3})).isEqualTo(0.0);
        assertThat(Similarity.cosine(new double[]{0, 0}, new double[]{1, 1})).isEqualTo(0.0);
    }

    @Test
    void shouldDecreaseEuclideanSimilarityWithDistance() {
        assertThat(Similarity.euclideanDistance(new double[]{0, 0}, new double[]{3, 4})).isCloseTo(5.0, within(1e-12));
        assertThat(Similarity.euclidean(new double[]{0, 0}, new double[]{3, 4})).isCloseTo(1.0 / 6.0, within(1e-12));
        assertThat(Similarity.euclidean(new double[]{1, 1}, new double[]{1, 1})).isEqualTo(1.0);
        assertThat(Similarity.euclidean(new double[]{1}, new double[]{1, 1})).isEqualTo(0.0);
        assertThat(Similarity.euclideanDistance(new double[]{1}, new double[]{1, 1})).isInfinite();
    }

    @Test
    void shouldOnlyCountKeysAboveThresholdInJaccard() {
        final Map<String, Double> a = Map.of("jazz", 0.9, "film", 0.6, "poetry", 0.1);
        final Map<String, Double> b = Map.of("jazz", 0.7, "poetry", 0.8);

        // active: a={jazz, film}, b={jazz, poetry}
        assertThat(Similarity.jaccard(a, b, 0.5)).isCloseTo(1.0 / 3.0, within(1e-12));
        assertThat(Similarity.jaccard(Map.of(), Map.of(), 0.5)).isEqualTo(0.0);
    }

    @Test
    void shouldTreatClusterSimilarityAsIdentity() {
        assertThat(Similarity.cluster("c1", "c1")).isEqualTo(1.0);
        assertThat(Similarity.cluster("c1", "c2")).isEqualTo(0.0);
    }
}
