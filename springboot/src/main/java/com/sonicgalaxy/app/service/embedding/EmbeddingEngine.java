package com.sonicgalaxy.app.service.embedding;

import com.sonicgalaxy.app.config.EmotionalSpaceProperties;
import com.sonicgalaxy.app.exception.InvalidFeatureSetException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns per-track feature vectors into 3D positions.
 * <p>
 * The strategy is picked by track count: PCA for tiny sets, UMAP for larger ones when enabled,
 * t-SNE in between. Whatever the strategy, the output is centred and scaled so the largest
 * absolute coordinate equals the configured radius. A strategy that throws or produces
 * non-finite values is replaced by PCA for that run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingEngine {

    private final EmotionalSpaceProperties properties;
    private final FeatureStandardizer standardizer;
    private final PcaEmbedding pcaEmbedding;
    private final TsneEmbedding tsneEmbedding;
    private final UmapEmbedding umapEmbedding;

    public EmbeddingResult embed(List<double[]> vectors) {
        validate(vectors);

        double[][] raw = vectors.toArray(new double[0][]);
        double[][] standardized = standardizer.standardize(raw);

        EmbeddingStrategy strategy = selectStrategy(raw.length);
        log.info("Computing semantic positions for {} tracks from {} features using {}",
                raw.length, raw[0].length, strategy.name());

        double[][] positions;
        boolean degraded = false;
        try {
            positions = strategy.embed(standardized);
            if (!isUsable(positions, raw.length)) {
                throw new IllegalStateException(strategy.name() + " produced non-finite or misshaped positions");
            }
        } catch (RuntimeException e) {
            if (strategy == pcaEmbedding) {
                log.warn("PCA projection failed, placing all {} tracks at the origin", raw.length, e);
                positions = new double[raw.length][EmbeddingStrategy.DIMENSIONS];
            } else {
                log.warn("{} embedding failed, falling back to PCA", strategy.name(), e);
                positions = fallback(standardized);
            }
            strategy = pcaEmbedding;
            degraded = true;
        }

        double[][] scaled = scalePositions(positions, properties.getEmbedding().getTargetRadius());
        log.debug("Semantic positions ready: {}", describeRange(scaled));
        return new EmbeddingResult(scaled, strategy.name(), degraded);
    }

    EmbeddingStrategy selectStrategy(int samples) {
        EmotionalSpaceProperties.Embedding config = properties.getEmbedding();
        if (samples <= config.getPcaMaxSamples()) {
            return pcaEmbedding;
        }
        if (config.isUmapEnabled() && samples > config.getUmapMinSamples()) {
            return umapEmbedding;
        }
        return tsneEmbedding;
    }

    private double[][] fallback(double[][] standardized) {
        try {
            double[][] positions = pcaEmbedding.embed(standardized);
            if (isUsable(positions, standardized.length)) {
                return positions;
            }
            log.warn("PCA fallback produced non-finite positions, placing tracks at the origin");
        } catch (RuntimeException e) {
            log.warn("PCA fallback failed, placing tracks at the origin", e);
        }
        return new double[standardized.length][EmbeddingStrategy.DIMENSIONS];
    }

    /**
     * Centres positions on their mean and scales them uniformly so the maximum absolute
     * coordinate equals {@code radius}. Coincident points are only centred.
     */
    public static double[][] scalePositions(double[][] positions, double radius) {
        int n = positions.length;
        double[][] scaled = new double[n][EmbeddingStrategy.DIMENSIONS];
        if (n == 0) {
            return scaled;
        }

        double[] mean = new double[EmbeddingStrategy.DIMENSIONS];
        for (double[] row : positions) {
            for (int d = 0; d < EmbeddingStrategy.DIMENSIONS; d++) {
                mean[d] += row[d] / n;
            }
        }

        double maxAbs = 0.0;
        for (int i = 0; i < n; i++) {
            for (int d = 0; d < EmbeddingStrategy.DIMENSIONS; d++) {
                scaled[i][d] = positions[i][d] - mean[d];
                maxAbs = Math.max(maxAbs, Math.abs(scaled[i][d]));
            }
        }

        if (maxAbs > 0) {
            double factor = radius / maxAbs;
            for (double[] row : scaled) {
                for (int d = 0; d < EmbeddingStrategy.DIMENSIONS; d++) {
                    row[d] *= factor;
                }
            }
        }
        return scaled;
    }

    private static void validate(List<double[]> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new InvalidFeatureSetException("Cannot embed an empty feature set");
        }
        int width = -1;
        for (int i = 0; i < vectors.size(); i++) {
            double[] vector = vectors.get(i);
            if (vector == null || vector.length == 0) {
                throw new InvalidFeatureSetException("Feature vector " + i + " is empty");
            }
            if (width >= 0 && vector.length != width) {
                throw new InvalidFeatureSetException(
                        "Feature vector " + i + " has " + vector.length + " dimensions, expected " + width);
            }
            width = vector.length;
            for (double value : vector) {
                if (!Double.isFinite(value)) {
                    throw new InvalidFeatureSetException("Feature vector " + i + " contains a non-finite value");
                }
            }
        }
    }

    private static boolean isUsable(double[][] positions, int rows) {
        if (positions == null || positions.length != rows) {
            return false;
        }
        for (double[] row : positions) {
            if (row == null || row.length != EmbeddingStrategy.DIMENSIONS) {
                return false;
            }
            for (double value : row) {
                if (!Double.isFinite(value)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static String describeRange(double[][] positions) {
        StringBuilder range = new StringBuilder();
        char[] axes = {'X', 'Y', 'Z'};
        for (int d = 0; d < EmbeddingStrategy.DIMENSIONS; d++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] row : positions) {
                min = Math.min(min, row[d]);
                max = Math.max(max, row[d]);
            }
            range.append(axes[d]).append(String.format("[%.1f, %.1f] ", min, max));
        }
        return range.toString().trim();
    }
}
