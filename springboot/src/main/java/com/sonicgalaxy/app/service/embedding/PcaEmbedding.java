package com.sonicgalaxy.app.service.embedding;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Linear projection onto the top three principal components. Used for very small
 * track sets and as the fallback whenever a manifold strategy fails.
 */
@Component
@RequiredArgsConstructor
public class PcaEmbedding implements EmbeddingStrategy {

    private final PrincipalComponents principalComponents;

    @Override
    public String name() {
        return "pca";
    }

    @Override
    public double[][] embed(double[][] vectors) {
        return principalComponents.fit(vectors, DIMENSIONS).getScores();
    }
}
