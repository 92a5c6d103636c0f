package com.sonicgalaxy.app.service.embedding;

/**
 * Maps standardized feature vectors (one row per track) to 3D positions, one row per track
 * in the same order. Implementations must be deterministic for identical input.
 */
public interface EmbeddingStrategy {

    int DIMENSIONS = 3;

    String name();

    double[][] embed(double[][] vectors);
}
