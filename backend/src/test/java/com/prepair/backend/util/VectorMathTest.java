package com.prepair.backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VectorMathTest {

    @Test
    void shouldReturnOneForIdenticalVectors() {
        float[] v = {0.3f, -1.2f, 4.5f, 0.01f};

        assertThat(VectorMath.cosineSimilarity(v, v)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldIgnoreMagnitude() {
        float[] a = {1f, 2f, 3f};
        float[] b = {2f, 4f, 6f};

        assertThat(VectorMath.cosineSimilarity(a, b)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldReturnZeroForOrthogonalVectors() {
        assertThat(VectorMath.cosineSimilarity(new float[]{1f, 0f}, new float[]{0f, 1f})).isEqualTo(0.0);
    }

    @Test
    void shouldReturnExactlyZeroForMismatchedLengths() {
        assertThat(VectorMath.cosineSimilarity(new float[]{1f, 2f}, new float[]{1f, 2f, 3f})).isEqualTo(0.0);
    }

    @Test
    void shouldReturnExactlyZeroForEmptyOrMissingVectors() {
        assertThat(VectorMath.cosineSimilarity(new float[0], new float[0])).isEqualTo(0.0);
        assertThat(VectorMath.cosineSimilarity(null, new float[]{1f})).isEqualTo(0.0);
        assertThat(VectorMath.cosineSimilarity(new float[]{1f}, null)).isEqualTo(0.0);
    }

    @Test
    void shouldReturnZeroForZeroMagnitudeVector() {
        assertThat(VectorMath.cosineSimilarity(new float[]{0f, 0f}, new float[]{1f, 1f})).isEqualTo(0.0);
    }
}
