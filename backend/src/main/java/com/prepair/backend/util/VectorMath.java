package com.prepair.backend.util;

/**
 * Numeric helpers for embedding vectors.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity of two embedding vectors.
     *
     * Returns 0 when either vector is null or empty, when the lengths differ,
     * or when either vector has zero magnitude. An unknown similarity is
     * treated as "unrelated".
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }

        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
