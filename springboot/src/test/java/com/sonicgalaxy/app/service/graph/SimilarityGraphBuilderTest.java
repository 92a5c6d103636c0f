package com.sonicgalaxy.app.service.graph;

import com.sonicgalaxy.app.ProfileFixtures;
import com.sonicgalaxy.app.config.EmotionalSpaceProperties;
import com.sonicgalaxy.app.model.EmotionalCoordinate;
import com.sonicgalaxy.app.model.GraphEdge;
import com.sonicgalaxy.app.model.SimilarityGraph;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityGraphBuilderTest {

    private final EmotionalSpaceProperties properties = new EmotionalSpaceProperties();
    private final SimilarityGraphBuilder builder = new SimilarityGraphBuilder(properties);

    @Test
    void chainConnectsOnlyAdjacentTracks() {
        Map<String, EmotionalCoordinate> coordinates = new LinkedHashMap<>();
        for (int i = 0; i < 5; i++) {
            coordinates.put("t" + i, ProfileFixtures.coordinate(i * 0.2, 0.5, 0.5, 0.5));
        }

        SimilarityGraph graph = builder.build(coordinates);

        assertEquals(5, graph.nodeCount());
        assertEquals(4, graph.edgeCount());
        assertTrue(graph.neighbors("t0").containsKey("t1"));
        assertFalse(graph.neighbors("t0").containsKey("t2"));

        GraphEdge edge = graph.neighbors("t2").get("t3");
        assertEquals(0.2, edge.getDistance(), 1e-12);
        assertEquals(1.0 / (0.2 + 1e-6), edge.getWeight(), 1e-6);
    }

    @Test
    void coincidentTracksAreNotConnected() {
        Map<String, EmotionalCoordinate> coordinates = new LinkedHashMap<>();
        coordinates.put("a", ProfileFixtures.coordinate(0.1, 0.1, 0.1, 0.1));
        coordinates.put("b", ProfileFixtures.coordinate(0.1, 0.1, 0.1, 0.1));
        coordinates.put("far", ProfileFixtures.coordinate(-1, 1, 1, 1));

        SimilarityGraph graph = builder.build(coordinates);

        assertEquals(3, graph.nodeCount());
        assertEquals(0, graph.edgeCount());
    }

    @Test
    void thresholdIsConfigurable() {
        properties.getGraph().setSimilarityThreshold(0.5);
        Map<String, EmotionalCoordinate> coordinates = new LinkedHashMap<>();
        coordinates.put("a", ProfileFixtures.coordinate(0, 0, 0, 0));
        coordinates.put("b", ProfileFixtures.coordinate(0.4, 0, 0, 0));

        assertEquals(1, builder.build(coordinates).edgeCount());
    }
}
