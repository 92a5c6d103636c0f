package com.sonicgalaxy.app.service.embedding;

import com.sonicgalaxy.app.config.EmotionalSpaceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.SimpleCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * UMAP layout for larger libraries, keeping both neighborhoods and the coarse arrangement
 * of regions.
 * <p>
 * Builds an exact k-nearest-neighbor fuzzy graph, starts from a PCA layout and refines it by
 * stochastic gradient descent with negative sampling. All sampling draws from a generator
 * seeded with the configured seed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UmapEmbedding implements EmbeddingStrategy {

    private static final double SMOOTH_K_TOLERANCE = 1e-5;
    private static final double MIN_K_DIST_SCALE = 1e-3;
    private static final int SIGMA_SEARCH_STEPS = 64;
    private static final double INITIAL_LEARNING_RATE = 1.0;
    private static final double GRADIENT_CLIP = 4.0;
    private static final double INITIAL_EXTENT = 10.0;

    // curve parameters for min_dist 0.1 / spread 1.0, used when fitting fails
    static final double DEFAULT_A = 1.577;
    static final double DEFAULT_B = 0.8951;

    private final EmotionalSpaceProperties properties;
    private final PrincipalComponents principalComponents;

    @Override
    public String name() {
        return "umap";
    }

    @Override
    public double[][] embed(double[][] vectors) {
        EmotionalSpaceProperties.Embedding config = properties.getEmbedding();
        int n = vectors.length;
        int neighbors = Math.min(n - 1, Math.max(2, Math.min(config.getUmapMaxNeighbors(), n / 3)));

        log.debug("UMAP over {} tracks, {} neighbors, {} epochs", n, neighbors, config.getUmapEpochs());

        FuzzyGraph graph = fuzzyGraph(vectors, neighbors);
        double[] ab = fitCurve(config.getUmapMinDist(), config.getUmapSpread());
        RandomGenerator random = new Well19937c(config.getRandomSeed());

        double[][] layout = initialLayout(vectors, random);
        optimize(layout, graph, ab[0], ab[1], config.getUmapEpochs(), config.getUmapNegativeSamples(), random);
        return layout;
    }

    static final class FuzzyGraph {
        final int[] heads;
        final int[] tails;
        final double[] weights;

        FuzzyGraph(int[] heads, int[] tails, double[] weights) {
            this.heads = heads;
            this.tails = tails;
            this.weights = weights;
        }
    }

    static FuzzyGraph fuzzyGraph(double[][] vectors, int k) {
        int n = vectors.length;
        int[][] knnIndices = new int[n][k];
        double[][] knnDistances = new double[n][k];

        for (int i = 0; i < n; i++) {
            final int self = i;
            double[] distances = new double[n];
            for (int j = 0; j < n; j++) {
                distances[j] = euclidean(vectors[i], vectors[j]);
            }
            int[] order = IntStream.range(0, n)
                    .filter(j -> j != self)
                    .boxed()
                    .sorted(Comparator.comparingDouble(j -> distances[j]))
                    .mapToInt(Integer::intValue)
                    .limit(k)
                    .toArray();
            for (int m = 0; m < k; m++) {
                knnIndices[i][m] = order[m];
                knnDistances[i][m] = distances[order[m]];
            }
        }

        double meanDistance = Arrays.stream(knnDistances).flatMapToDouble(Arrays::stream).average().orElse(0.0);
        double target = Math.log(k) / Math.log(2);

        // keyed by i * n + j with i < j; sorted keys keep edge order reproducible
        Map<Long, Double> symmetric = new TreeMap<>();
        Map<Long, Double> directed = new TreeMap<>();

        for (int i = 0; i < n; i++) {
            double rho = 0.0;
            for (double d : knnDistances[i]) {
                if (d > 0) {
                    rho = d;
                    break;
                }
            }
            double sigma = smoothDistance(knnDistances[i], rho, target, meanDistance);
            for (int m = 0; m < k; m++) {
                int j = knnIndices[i][m];
                double d = knnDistances[i][m] - rho;
                double membership = d <= 0 ? 1.0 : Math.exp(-d / sigma);
                directed.put((long) i * n + j, membership);
            }
        }

        for (Map.Entry<Long, Double> entry : directed.entrySet()) {
            int i = (int) (entry.getKey() / n);
            int j = (int) (entry.getKey() % n);
            double forward = entry.getValue();
            double backward = directed.getOrDefault((long) j * n + i, 0.0);
            long key = i < j ? (long) i * n + j : (long) j * n + i;
            symmetric.put(key, forward + backward - forward * backward);
        }

        int edges = symmetric.size();
        int[] heads = new int[edges];
        int[] tails = new int[edges];
        double[] weights = new double[edges];
        int e = 0;
        for (Map.Entry<Long, Double> entry : symmetric.entrySet()) {
            heads[e] = (int) (entry.getKey() / n);
            tails[e] = (int) (entry.getKey() % n);
            weights[e] = entry.getValue();
            e++;
        }
        return new FuzzyGraph(heads, tails, weights);
    }

    private static double smoothDistance(double[] distances, double rho, double target, double meanDistance) {
        double lo = 0.0;
        double hi = Double.POSITIVE_INFINITY;
        double mid = 1.0;

        for (int step = 0; step < SIGMA_SEARCH_STEPS; step++) {
            double sum = 0.0;
            for (double distance : distances) {
                double d = distance - rho;
                sum += d > 0 ? Math.exp(-d / mid) : 1.0;
            }
            if (Math.abs(sum - target) < SMOOTH_K_TOLERANCE) {
                break;
            }
            if (sum > target) {
                hi = mid;
                mid = (lo + hi) / 2.0;
            } else {
                lo = mid;
                mid = hi == Double.POSITIVE_INFINITY ? mid * 2 : (lo + hi) / 2.0;
            }
        }

        double floor = MIN_K_DIST_SCALE * (rho > 0 ? meanOf(distances) : meanDistance);
        return Math.max(mid, floor > 0 ? floor : MIN_K_DIST_SCALE);
    }

    /**
     * Fits {@code 1 / (1 + a * x^(2b))} to the target membership curve implied by
     * {@code minDist} and {@code spread}.
     */
    static double[] fitCurve(double minDist, double spread) {
        WeightedObservedPoints points = new WeightedObservedPoints();
        int samples = 300;
        for (int i = 0; i < samples; i++) {
            double x = spread * 3.0 * i / (samples - 1);
            double y = x < minDist ? 1.0 : Math.exp(-(x - minDist) / spread);
            points.add(x, y);
        }

        ParametricUnivariateFunction curve = new ParametricUnivariateFunction() {
            @Override
            public double value(double x, double... p) {
                return 1.0 / (1.0 + p[0] * Math.pow(x, 2 * p[1]));
            }

            @Override
            public double[] gradient(double x, double... p) {
                if (x <= 0) {
                    return new double[]{0.0, 0.0};
                }
                double pow = Math.pow(x, 2 * p[1]);
                double denominator = (1.0 + p[0] * pow) * (1.0 + p[0] * pow);
                return new double[]{
                        -pow / denominator,
                        -2.0 * p[0] * pow * Math.log(x) / denominator
                };
            }
        };

        try {
            double[] fitted = SimpleCurveFitter.create(curve, new double[]{1.0, 1.0})
                    .withMaxIterations(1000)
                    .fit(points.toList());
            if (fitted[0] > 0 && fitted[1] > 0 && Double.isFinite(fitted[0]) && Double.isFinite(fitted[1])) {
                return fitted;
            }
            log.warn("UMAP curve fit produced unusable parameters a={}, b={}; using defaults", fitted[0], fitted[1]);
        } catch (MathIllegalStateException e) {
            log.warn("UMAP curve fit did not converge; using defaults", e);
        }
        return new double[]{DEFAULT_A, DEFAULT_B};
    }

    private double[][] initialLayout(double[][] vectors, RandomGenerator random) {
        double[][] layout = principalComponents.fit(vectors, DIMENSIONS).getScores();
        double extent = 0.0;
        for (double[] row : layout) {
            for (double value : row) {
                extent = Math.max(extent, Math.abs(value));
            }
        }
        for (double[] row : layout) {
            for (int d = 0; d < DIMENSIONS; d++) {
                row[d] = extent > 0
                        ? row[d] * INITIAL_EXTENT / extent
                        : (random.nextDouble() * 2.0 - 1.0) * INITIAL_EXTENT;
            }
        }
        return layout;
    }

    private static void optimize(double[][] layout, FuzzyGraph graph, double a, double b,
                                 int epochs, int negativeRate, RandomGenerator random) {
        int edges = graph.weights.length;
        if (edges == 0) {
            return;
        }
        int n = layout.length;
        double maxWeight = Arrays.stream(graph.weights).max().orElse(1.0);

        double[] epochsPerSample = new double[edges];
        double[] nextSample = new double[edges];
        double[] epochsPerNegative = new double[edges];
        double[] nextNegative = new double[edges];
        for (int e = 0; e < edges; e++) {
            epochsPerSample[e] = maxWeight / graph.weights[e];
            nextSample[e] = epochsPerSample[e];
            epochsPerNegative[e] = epochsPerSample[e] / negativeRate;
            nextNegative[e] = epochsPerNegative[e];
        }

        for (int epoch = 0; epoch < epochs; epoch++) {
            double alpha = INITIAL_LEARNING_RATE * (1.0 - (double) epoch / epochs);

            for (int e = 0; e < edges; e++) {
                if (nextSample[e] > epoch) {
                    continue;
                }
                double[] current = layout[graph.heads[e]];
                double[] other = layout[graph.tails[e]];

                double distSq = squared(current, other);
                double attract = distSq > 0
                        ? (-2.0 * a * b * Math.pow(distSq, b - 1.0)) / (a * Math.pow(distSq, b) + 1.0)
                        : 0.0;
                for (int d = 0; d < DIMENSIONS; d++) {
                    double grad = clip(attract * (current[d] - other[d]));
                    current[d] += grad * alpha;
                    other[d] -= grad * alpha;
                }
                nextSample[e] += epochsPerSample[e];

                int negatives = (int) Math.max(0, (epoch - nextNegative[e]) / epochsPerNegative[e]);
                for (int s = 0; s < negatives; s++) {
                    int sampled = random.nextInt(n);
                    if (sampled == graph.heads[e]) {
                        continue;
                    }
                    double[] negative = layout[sampled];
                    double negSq = squared(current, negative);
                    double repel = negSq > 0
                            ? (2.0 * b) / ((0.001 + negSq) * (a * Math.pow(negSq, b) + 1.0))
                            : 0.0;
                    for (int d = 0; d < DIMENSIONS; d++) {
                        double grad = repel > 0 ? clip(repel * (current[d] - negative[d])) : GRADIENT_CLIP;
                        current[d] += grad * alpha;
                    }
                }
                nextNegative[e] += negatives * epochsPerNegative[e];
            }
        }
    }

    private static double clip(double value) {
        return Math.max(-GRADIENT_CLIP, Math.min(GRADIENT_CLIP, value));
    }

    private static double squared(double[] p, double[] q) {
        double sum = 0.0;
        for (int d = 0; d < DIMENSIONS; d++) {
            double diff = p[d] - q[d];
            sum += diff * diff;
        }
        return sum;
    }

    private static double euclidean(double[] p, double[] q) {
        double sum = 0.0;
        for (int d = 0; d < p.length; d++) {
            double diff = p[d] - q[d];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    private static double meanOf(double[] values) {
        return Arrays.stream(values).average().orElse(0.0);
    }
}
