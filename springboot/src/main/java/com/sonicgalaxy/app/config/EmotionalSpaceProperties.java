package com.sonicgalaxy.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the emotional space engine.
 *
 * application.yml:
 *
 * app:
 *   emotional-space:
 *     embedding:
 *       target-radius: 25.0
 *       umap-min-samples: 15
 *     graph:
 *       similarity-threshold: 0.3
 *     export:
 *       max-connections: 20000
 */
@Data
@ConfigurationProperties(prefix = "app.emotional-space")
public class EmotionalSpaceProperties {

    private Embedding embedding = new Embedding();
    private Graph graph = new Graph();
    private Journey journey = new Journey();
    private Clustering clustering = new Clustering();
    private Export export = new Export();
    private Store store = new Store();

    private double filterTolerance = 0.3;

    @Data
    public static class Embedding {
        private double targetRadius = 25.0;
        private long randomSeed = 42L;

        // at or below this many tracks only a linear projection is attempted
        private int pcaMaxSamples = 3;

        private boolean umapEnabled = true;
        private int umapMinSamples = 15;
        private int umapMaxNeighbors = 15;
        private double umapMinDist = 0.1;
        private double umapSpread = 1.0;
        private int umapEpochs = 200;
        private int umapNegativeSamples = 5;

        private double tsneMaxPerplexity = 30.0;
        private int tsneIterations = 1000;
        private int tsnePcaDimensions = 50;
    }

    @Data
    public static class Graph {
        private double similarityThreshold = 0.3;
        private double epsilon = 1e-6;
    }

    @Data
    public static class Journey {
        private int defaultMaxSteps = 10;
        private double defaultDurationSeconds = 60.0;
        private double bridgeThreshold = 0.7;
    }

    @Data
    public static class Clustering {
        private int maxClusters = 5;
        private int restarts = 10;
        private int maxIterations = 300;
        private long randomSeed = 42L;
    }

    @Data
    public static class Export {
        private int maxConnections = 20000;
        private String file = "data/emotional_space_data.json";
    }

    @Data
    public static class Store {
        private String file = "data/sonic_dna/sonic_dna_profiles.json";
    }
}
