package com.sonicgalaxy.app.service.embedding;

import com.sonicgalaxy.app.config.EmotionalSpaceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Exact t-SNE, tuned for local neighborhood preservation on small and medium libraries.
 * <p>
 * Wide inputs are first reduced with PCA, the layout starts from the PCA projection, and the
 * first {@value #EXAGGERATION_ITERATIONS} iterations run with early exaggeration. The cost is
 * quadratic in the number of tracks per iteration.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TsneEmbedding implements EmbeddingStrategy {

    static final int EXAGGERATION_ITERATIONS = 250;
    private static final double EARLY_EXAGGERATION = 12.0;
    private static final double INITIAL_MOMENTUM = 0.5;
    private static final double FINAL_MOMENTUM = 0.8;
    private static final double MIN_GAIN = 0.01;
    private static final double INIT_SCALE = 1e-4;
    private static final double MACHINE_EPSILON = 2.220446049250313e-16;

    private static final int BINARY_SEARCH_STEPS = 100;
    private static final double ENTROPY_TOLERANCE = 1e-5;

    private final EmotionalSpaceProperties properties;
    private final PrincipalComponents principalComponents;

    @Override
    public String name() {
        return "tsne";
    }

    @Override
    public double[][] embed(double[][] vectors) {
        EmotionalSpaceProperties.Embedding config = properties.getEmbedding();
        int n = vectors.length;

        double[][] input = vectors;
        int reducedWidth = Math.min(config.getTsnePcaDimensions(), n);
        if (vectors[0].length > config.getTsnePcaDimensions()) {
            input = principalComponents.fit(vectors, reducedWidth).getScores();
        }

        double perplexity = Math.max(1.0, Math.min(config.getTsneMaxPerplexity(), n / 4));
        log.debug("t-SNE over {} tracks, perplexity {}, {} iterations", n, perplexity, config.getTsneIterations());

        double[][] p = jointProbabilities(squaredDistances(input), perplexity);
        double[][] y = initialLayout(input, config.getRandomSeed());
        optimize(p, y, config.getTsneIterations());
        return y;
    }

    private double[][] initialLayout(double[][] input, long seed) {
        int n = input.length;
        double[][] y = principalComponents.fit(input, DIMENSIONS).getScores();

        double mean = 0.0;
        for (double[] row : y) {
            mean += row[0] / n;
        }
        double variance = 0.0;
        for (double[] row : y) {
            variance += (row[0] - mean) * (row[0] - mean) / n;
        }
        double std = Math.sqrt(variance);

        if (std > 0) {
            for (double[] row : y) {
                for (int d = 0; d < DIMENSIONS; d++) {
                    row[d] = row[d] / std * INIT_SCALE;
                }
            }
        } else {
            RandomGenerator random = new Well19937c(seed);
            for (double[] row : y) {
                for (int d = 0; d < DIMENSIONS; d++) {
                    row[d] = random.nextGaussian() * INIT_SCALE;
                }
            }
        }
        return y;
    }

    private void optimize(double[][] p, double[][] y, int iterations) {
        int n = y.length;
        double learningRate = Math.max(n / EARLY_EXAGGERATION / 4.0, 50.0);
        double[][] update = new double[n][DIMENSIONS];
        double[][] gains = new double[n][DIMENSIONS];
        for (double[] row : gains) {
            Arrays.fill(row, 1.0);
        }

        double[][] num = new double[n][n];
        double[][] gradient = new double[n][DIMENSIONS];

        for (int iter = 0; iter < iterations; iter++) {
            boolean exaggerating = iter < EXAGGERATION_ITERATIONS;
            double exaggeration = exaggerating ? EARLY_EXAGGERATION : 1.0;
            double momentum = exaggerating ? INITIAL_MOMENTUM : FINAL_MOMENTUM;

            double sumNum = 0.0;
            for (int i = 0; i < n; i++) {
                num[i][i] = 0.0;
                for (int j = i + 1; j < n; j++) {
                    double dist = 0.0;
                    for (int d = 0; d < DIMENSIONS; d++) {
                        double diff = y[i][d] - y[j][d];
                        dist += diff * diff;
                    }
                    double q = 1.0 / (1.0 + dist);
                    num[i][j] = q;
                    num[j][i] = q;
                    sumNum += 2.0 * q;
                }
            }
            sumNum = Math.max(sumNum, MACHINE_EPSILON);

            for (int i = 0; i < n; i++) {
                double[] g = gradient[i];
                Arrays.fill(g, 0.0);
                for (int j = 0; j < n; j++) {
                    if (i == j) {
                        continue;
                    }
                    double q = Math.max(num[i][j] / sumNum, MACHINE_EPSILON);
                    double mult = (exaggeration * p[i][j] - q) * num[i][j];
                    for (int d = 0; d < DIMENSIONS; d++) {
                        g[d] += 4.0 * mult * (y[i][d] - y[j][d]);
                    }
                }
            }

            for (int i = 0; i < n; i++) {
                for (int d = 0; d < DIMENSIONS; d++) {
                    double grad = gradient[i][d];
                    boolean sameDirection = (grad > 0) == (update[i][d] > 0);
                    gains[i][d] = sameDirection ? gains[i][d] * 0.8 : gains[i][d] + 0.2;
                    gains[i][d] = Math.max(gains[i][d], MIN_GAIN);
                    update[i][d] = momentum * update[i][d] - learningRate * gains[i][d] * grad;
                    y[i][d] += update[i][d];
                }
            }
        }
    }

    static double[][] squaredDistances(double[][] x) {
        int n = x.length;
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double sum = 0.0;
                for (int d = 0; d < x[i].length; d++) {
                    double diff = x[i][d] - x[j][d];
                    sum += diff * diff;
                }
                distances[i][j] = sum;
                distances[j][i] = sum;
            }
        }
        return distances;
    }

    /**
     * Conditional probabilities matched to the target perplexity by binary search on the
     * Gaussian precision, then symmetrized and normalized to sum to one.
     */
    static double[][] jointProbabilities(double[][] distances, double perplexity) {
        int n = distances.length;
        double[][] conditional = new double[n][n];
        double targetEntropy = Math.log(perplexity);

        for (int i = 0; i < n; i++) {
            double beta = 1.0;
            double betaMin = Double.NEGATIVE_INFINITY;
            double betaMax = Double.POSITIVE_INFINITY;
            double[] row = conditional[i];

            for (int step = 0; step < BINARY_SEARCH_STEPS; step++) {
                double sumP = 0.0;
                for (int j = 0; j < n; j++) {
                    row[j] = j == i ? 0.0 : Math.exp(-distances[i][j] * beta);
                    sumP += row[j];
                }
                if (sumP == 0.0) {
                    sumP = MACHINE_EPSILON;
                }
                double weighted = 0.0;
                for (int j = 0; j < n; j++) {
                    row[j] /= sumP;
                    weighted += distances[i][j] * row[j];
                }
                double entropy = Math.log(sumP) + beta * weighted;
                double diff = entropy - targetEntropy;
                if (Math.abs(diff) <= ENTROPY_TOLERANCE) {
                    break;
                }
                if (diff > 0) {
                    betaMin = beta;
                    beta = betaMax == Double.POSITIVE_INFINITY ? beta * 2.0 : (beta + betaMax) / 2.0;
                } else {
                    betaMax = beta;
                    beta = betaMin == Double.NEGATIVE_INFINITY ? beta / 2.0 : (beta + betaMin) / 2.0;
                }
            }
        }

        double[][] joint = new double[n][n];
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                joint[i][j] = conditional[i][j] + conditional[j][i];
                total += joint[i][j];
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                joint[i][j] = i == j ? 0.0 : Math.max(joint[i][j] / total, MACHINE_EPSILON);
            }
        }
        return joint;
    }
}
