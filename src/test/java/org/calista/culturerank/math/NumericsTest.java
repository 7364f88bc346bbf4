package org.calista.culturerank.math;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NumericsTest {

    @Test
    void shouldClampNonFiniteValuesToBounds() {
        assertThat(Numerics.clamp01(Double.NaN)).isEqualTo(0.0);
        assertThat(Numerics.clamp01(Double.POSITIVE_INFINITY)).isEqualTo(1.0);
        assertThat(Numerics.clamp01(Double.NEGATIVE_INFINITY)).isEqualTo(0.0);
        assertThat(Numerics.clamp(5.0, 0.0, 2.0)).isEqualTo(2.0);
        assertThat(Numerics.clamp(-5.0, 0.0, 2.0)).isEqualTo(0.0);
    }

    @Test
    void shouldRoundToNineDigits() {
        assertThat(Numerics.round9(0.1234567894)).isEqualTo(0.123456789);
        assertThat(Numerics.round9(0.1234567896)).isEqualTo(0.12345679);
        assertThat(Numerics.round9(Double.NaN)).isEqualTo(0.0);
    }

    @Test
    void shouldRoundIdempotently() {
        final double[] samples = {0.0, 1.0, -0.3, 0.123456789123, 0.55 * 0.3 + 0.25 * 0.7, 1e-12, 12345.678901234, -0.9999999995};
        for (double v : samples) {
            final double once = Numerics.round9(v);
            assertThat(Numerics.round9(once)).as("round9 twice for %s", v).isEqualTo(once);
        }
    }

    @Test
    void shouldFallBackOnZeroAndNonFiniteDivision() {
        assertThat(Numerics.safeDiv(1.0, 0.0, 7.0)).isEqualTo(7.0);
        assertThat(Numerics.safeDiv(Double.NaN, 2.0, 0.5)).isEqualTo(0.5);
        assertThat(Numerics.safeDiv(3.0, 2.0, 0.0)).isCloseTo(1.5, within(1e-12));
    }

    @Test
    void shouldInterpolateLinearly() {
        assertThat(Numerics.lerp(1.5, 0.5, 0.0)).isEqualTo(1.5);
        assertThat(Numerics.lerp(1.5, 0.5, 1.0)).isEqualTo(0.5);
        assertThat(Numerics.lerp(1.5, 0.5, 0.5)).isEqualTo(1.0);
    }
}
