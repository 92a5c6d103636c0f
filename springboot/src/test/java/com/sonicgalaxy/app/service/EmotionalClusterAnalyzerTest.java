package com.sonicgalaxy.app.service;

import com.sonicgalaxy.app.ProfileFixtures;
import com.sonicgalaxy.app.config.EmotionalSpaceProperties;
import com.sonicgalaxy.app.dto.response.ClusterReport;
import com.sonicgalaxy.app.dto.response.EmotionalStatistics;
import com.sonicgalaxy.app.model.Cluster;
import com.sonicgalaxy.app.model.EmotionalCoordinate;
import com.sonicgalaxy.app.service.embedding.PrincipalComponents;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EmotionalClusterAnalyzerTest {

    private final EmotionalSpaceProperties properties = new EmotionalSpaceProperties();
    private final EmotionalClusterAnalyzer analyzer = new EmotionalClusterAnalyzer(properties, new PrincipalComponents());

    @Test
    void identicalTracksHaveNoSpread() {
        Map<String, EmotionalCoordinate> coordinates = new LinkedHashMap<>();
        coordinates.put("a", ProfileFixtures.coordinate(0.3, 0.6, 0.2, 0.9));
        coordinates.put("b", ProfileFixtures.coordinate(0.3, 0.6, 0.2, 0.9));

        EmotionalStatistics statistics = analyzer.statistics(ProfileFixtures.snapshot(properties, coordinates));

        assertEquals(2, statistics.getTrackCount());
        assertEquals(List.of("valence", "energy", "complexity", "tension"),
                new ArrayList<>(statistics.getEmotionalRanges().keySet()));
        assertEquals(0.0, statistics.getEmotionalSpread().get("valence"));
        assertEquals(0.6, statistics.getEmotionalCenter().get("energy"), 1e-12);
        assertEquals(0.9, statistics.getEmotionalRanges().get("tension").getMax(), 1e-12);
    }

    @Test
    void spreadIsPopulationStandardDeviation() {
        Map<String, EmotionalCoordinate> coordinates = new LinkedHashMap<>();
        coordinates.put("a", ProfileFixtures.coordinate(-1, 0, 0, 0));
        coordinates.put("b", ProfileFixtures.coordinate(1, 1, 0, 0));

        EmotionalStatistics statistics = analyzer.statistics(ProfileFixtures.snapshot(properties, coordinates));

        assertEquals(1.0, statistics.getEmotionalSpread().get("valence"), 1e-12);
        assertEquals(0.5, statistics.getEmotionalSpread().get("energy"), 1e-12);
        assertEquals(-1.0, statistics.getEmotionalRanges().get("valence").getMin(), 1e-12);
    }

    @Test
    void emptySpaceHasEmptyStatistics() {
        EmotionalStatistics statistics = analyzer.statistics(EmotionalSpaceSnapshot.empty());

        assertTrue(statistics.isEmpty());
        assertTrue(statistics.getEmotionalRanges().isEmpty());
    }

    @Test
    void everyTrackLandsInExactlyOneCluster() {
        EmotionalSpaceSnapshot space = ProfileFixtures.snapshot(properties, coordinates(12));

        ClusterReport report = analyzer.clusters(space);

        assertEquals(12, report.getTotalTracks());
        assertTrue(report.getClusters().size() >= 2 && report.getClusters().size() <= 5);
        Set<String> assigned = new HashSet<>();
        int total = 0;
        for (Cluster cluster : report.getClusters()) {
            assigned.addAll(cluster.getTrackIds());
            total += cluster.getSize();
        }
        assertEquals(12, total);
        assertEquals(space.getCoordinates().keySet(), assigned);
        assertEquals("cluster_0", report.getClusters().get(0).getId());
    }

    @Test
    void clusteringIsReproducible() {
        EmotionalSpaceSnapshot space = ProfileFixtures.snapshot(properties, coordinates(12));

        assertEquals(analyzer.clusters(space).getClusters(), analyzer.clusters(space).getClusters());
    }

    @Test
    void pcaProjectionAccompaniesClusters() {
        ClusterReport report = analyzer.clusters(ProfileFixtures.snapshot(properties, coordinates(12)));

        assertEquals(12, report.getPcaCoordinates().size());
        assertEquals(4, report.getPcaExplainedVariance().size());
        double sum = report.getPcaExplainedVariance().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, sum, 1e-9);
    }

    @Test
    void fewerThanTwoTracksGiveNoClusters() {
        Map<String, EmotionalCoordinate> coordinates = new LinkedHashMap<>();
        coordinates.put("only", ProfileFixtures.coordinate(0, 0, 0, 0));

        ClusterReport report = analyzer.clusters(ProfileFixtures.snapshot(properties, coordinates));

        assertEquals(1, report.getTotalTracks());
        assertTrue(report.getClusters().isEmpty());
    }

    @Test
    void identicalTracksFormOneCluster() {
        Map<String, EmotionalCoordinate> coordinates = new LinkedHashMap<>();
        for (int i = 0; i < 4; i++) {
            coordinates.put("same_" + i, ProfileFixtures.coordinate(0.2, 0.2, 0.2, 0.2));
        }

        ClusterReport report = analyzer.clusters(ProfileFixtures.snapshot(properties, coordinates));

        assertEquals(1, report.getClusters().size());
        assertEquals(4, report.getClusters().get(0).getSize());
        assertEquals(0.2, report.getClusters().get(0).getCentroid().getValence(), 1e-12);
    }

    private static Map<String, EmotionalCoordinate> coordinates(int count) {
        Map<String, EmotionalCoordinate> coordinates = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            double offset = (i % 4) * 0.01;
            switch (i % 3) {
                case 0:
                    coordinates.put("sad_" + i, ProfileFixtures.coordinate(-0.8 + offset, 0.2, 0.3, 0.2));
                    break;
                case 1:
                    coordinates.put("happy_" + i, ProfileFixtures.coordinate(0.8 - offset, 0.9, 0.4, 0.3));
                    break;
                default:
                    coordinates.put("tense_" + i, ProfileFixtures.coordinate(0.0, 0.6, 0.9 - offset, 0.9));
                    break;
            }
        }
        return coordinates;
    }
}
