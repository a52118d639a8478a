package com.prepair.backend.service.provider;

/**
 * Turns text into an embedding vector.
 *
 * Implementations never throw: a failed call yields an empty array, which
 * {@link com.prepair.backend.util.VectorMath#cosineSimilarity} scores as 0.
 */
public interface EmbeddingProvider {

    float[] embed(String model, String text);
}
