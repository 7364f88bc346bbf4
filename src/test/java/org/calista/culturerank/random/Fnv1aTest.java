package org.calista.culturerank.random;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class Fnv1aTest {

    @Test
    void shouldHashEmptyInputToOffsetBasis() {
        assertThat(Fnv1a.hash64("")).isEqualTo(Fnv1a.OFFSET_BASIS);
        assertThat(Fnv1a.hash64((String) null)).isEqualTo(Fnv1a.OFFSET_BASIS);
    }

    @Test
    void shouldMatchReferenceVectors() {
        assertThat(Fnv1a.hex64(Fnv1a.hash64("a"))).isEqualTo("af63dc4c8601ec8c");
        assertThat(Fnv1a.hex64(Fnv1a.hash64("foobar"))).isEqualTo("85944171f73967e8");
        assertThat(Fnv1a.hash64("fixed-seed-123")).isEqualTo(0xae3282cfac5b2bf4L);
    }

    @Test
    void shouldHashUtf8Bytes() {
        assertThat(Fnv1a.hash64("é")).isEqualTo(Fnv1a.hash64(new byte[]{(byte) 0xC3, (byte) 0xA9}));
    }

    @Test
    void shouldZeroPadHex() {
        assertThat(Fnv1a.hex64(0x1fL)).isEqualTo("000000000000001f");
        assertThat(Fnv1a.hex64(-1L)).isEqualTo("ffffffffffffffff");
    }

    @Test
    void shouldNeverProduceZeroSeed() {
        assertThat(Fnv1a.seedOf("anything")).isNotZero();
    }
}
