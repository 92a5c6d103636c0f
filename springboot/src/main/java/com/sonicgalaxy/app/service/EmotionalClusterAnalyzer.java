package com.sonicgalaxy.app.service;

import com.sonicgalaxy.app.config.EmotionalSpaceProperties;
import com.sonicgalaxy.app.dto.response.ClusterReport;
import com.sonicgalaxy.app.dto.response.DimensionStatistics;
import com.sonicgalaxy.app.dto.response.EmotionalStatistics;
import com.sonicgalaxy.app.model.Cluster;
import com.sonicgalaxy.app.model.EmotionalCoordinate;
import com.sonicgalaxy.app.service.embedding.PrincipalComponents;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.clustering.MultiKMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Max;
import org.apache.commons.math3.stat.descriptive.rank.Min;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Aggregate views of a snapshot: per-dimension statistics, k-means groups over the raw
 * emotional coordinates, and a PCA projection of the same coordinates for diagnostics.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmotionalClusterAnalyzer {

    static final List<String> DIMENSIONS = List.of("valence", "energy", "complexity", "tension");

    private final EmotionalSpaceProperties properties;
    private final PrincipalComponents principalComponents;

    public EmotionalStatistics statistics(EmotionalSpaceSnapshot space) {
        if (space.isEmpty()) {
            return EmotionalStatistics.empty();
        }

        double[][] columns = columns(space);
        Map<String, DimensionStatistics> ranges = new LinkedHashMap<>();
        Map<String, Double> center = new LinkedHashMap<>();
        Map<String, Double> spread = new LinkedHashMap<>();

        for (int d = 0; d < DIMENSIONS.size(); d++) {
            double[] values = columns[d];
            DimensionStatistics stats = DimensionStatistics.builder()
                    .min(new Min().evaluate(values))
                    .max(new Max().evaluate(values))
                    .mean(new Mean().evaluate(values))
                    .std(new StandardDeviation(false).evaluate(values))
                    .build();
            ranges.put(DIMENSIONS.get(d), stats);
            center.put(DIMENSIONS.get(d), stats.getMean());
            spread.put(DIMENSIONS.get(d), stats.getStd());
        }

        return EmotionalStatistics.builder()
                .trackCount(space.size())
                .emotionalRanges(ranges)
                .emotionalCenter(center)
                .emotionalSpread(spread)
                .build();
    }

    public ClusterReport clusters(EmotionalSpaceSnapshot space) {
        int n = space.size();
        if (n < 2) {
            return ClusterReport.builder().totalTracks(n).build();
        }

        List<TrackPoint> points = new ArrayList<>(n);
        space.getCoordinates().forEach((trackId, coordinate) -> points.add(new TrackPoint(trackId, coordinate.toArray())));

        ClusterReport report = ClusterReport.builder()
                .totalTracks(n)
                .clusters(kMeans(points))
                .build();

        try {
            double[][] raw = points.stream().map(TrackPoint::getPoint).toArray(double[][]::new);
            PrincipalComponents.Projection projection = principalComponents.fit(raw, Math.min(DIMENSIONS.size(), n));
            report.setPcaExplainedVariance(Arrays.stream(projection.getExplainedVarianceRatio())
                    .boxed()
                    .collect(Collectors.toList()));
            report.setPcaCoordinates(Arrays.stream(projection.getScores())
                    .map(row -> Arrays.stream(row).boxed().collect(Collectors.toList()))
                    .collect(Collectors.toList()));
        } catch (IllegalStateException e) {
            log.warn("PCA projection of {} emotional coordinates failed, reporting clusters only", n, e);
        }
        return report;
    }

    private List<Cluster> kMeans(List<TrackPoint> points) {
        EmotionalSpaceProperties.Clustering config = properties.getClustering();
        int k = Math.min(Math.min(config.getMaxClusters(), points.size()), distinctCount(points));

        if (k < 2) {
            log.debug("Only one distinct emotional position among {} tracks, single cluster", points.size());
            return List.of(singleCluster(points));
        }

        KMeansPlusPlusClusterer<TrackPoint> clusterer = new KMeansPlusPlusClusterer<>(
                k, config.getMaxIterations(), new EuclideanDistance(),
                new JDKRandomGenerator((int) config.getRandomSeed()));
        MultiKMeansPlusPlusClusterer<TrackPoint> restarts =
                new MultiKMeansPlusPlusClusterer<>(clusterer, Math.max(1, config.getRestarts()));

        List<CentroidCluster<TrackPoint>> found;
        try {
            found = restarts.cluster(points);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            log.warn("k-means with k={} failed over {} tracks, reporting a single cluster", k, points.size(), e);
            return List.of(singleCluster(points));
        }

        List<Cluster> clusters = new ArrayList<>(found.size());
        for (int i = 0; i < found.size(); i++) {
            CentroidCluster<TrackPoint> cluster = found.get(i);
            clusters.add(Cluster.builder()
                    .id("cluster_" + i)
                    .trackIds(cluster.getPoints().stream().map(TrackPoint::getTrackId).collect(Collectors.toList()))
                    .centroid(EmotionalCoordinate.fromArray(cluster.getCenter().getPoint()))
                    .build());
        }
        log.debug("Clustered {} tracks into {} groups", points.size(), clusters.size());
        return clusters;
    }

    private static Cluster singleCluster(List<TrackPoint> points) {
        double[] centroid = new double[DIMENSIONS.size()];
        for (TrackPoint point : points) {
            for (int d = 0; d < centroid.length; d++) {
                centroid[d] += point.getPoint()[d] / points.size();
            }
        }
        return Cluster.builder()
                .id("cluster_0")
                .trackIds(points.stream().map(TrackPoint::getTrackId).collect(Collectors.toList()))
                .centroid(EmotionalCoordinate.fromArray(centroid))
                .build();
    }

    private static int distinctCount(List<TrackPoint> points) {
        Set<List<Double>> distinct = new HashSet<>();
        for (TrackPoint point : points) {
            distinct.add(Arrays.stream(point.getPoint()).boxed().collect(Collectors.toList()));
        }
        return distinct.size();
    }

    private static double[][] columns(EmotionalSpaceSnapshot space) {
        double[][] columns = new double[DIMENSIONS.size()][space.size()];
        int row = 0;
        for (EmotionalCoordinate coordinate : space.getCoordinates().values()) {
            double[] values = coordinate.toArray();
            for (int d = 0; d < values.length; d++) {
                columns[d][row] = values[d];
            }
            row++;
        }
        return columns;
    }

    @Getter
    @RequiredArgsConstructor
    static class TrackPoint implements Clusterable {
        private final String trackId;
        private final double[] point;
    }
}
