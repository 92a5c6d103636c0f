package com.sonicgalaxy.app.service;

import com.sonicgalaxy.app.ProfileFixtures;
import com.sonicgalaxy.app.config.EmotionalSpaceProperties;
import com.sonicgalaxy.app.model.EmotionalCoordinate;
import com.sonicgalaxy.app.model.PathResult;
import com.sonicgalaxy.app.model.TrackDistance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EmotionalPathFinderTest {

    private final EmotionalSpaceProperties properties = new EmotionalSpaceProperties();
    private final EmotionalPathFinder pathFinder = new EmotionalPathFinder();

    private EmotionalSpaceSnapshot chain;
    private EmotionalSpaceSnapshot islands;

    @BeforeEach
    void setUp() {
        Map<String, EmotionalCoordinate> chained = new LinkedHashMap<>();
        for (int i = 0; i < 5; i++) {
            chained.put("t" + i, ProfileFixtures.coordinate(i * 0.2, 0.5, 0.5, 0.5));
        }
        chain = ProfileFixtures.snapshot(properties, chained);

        Map<String, EmotionalCoordinate> separated = new LinkedHashMap<>();
        separated.put("low", ProfileFixtures.coordinate(-1.0, 0.5, 0.5, 0.5));
        separated.put("mid", ProfileFixtures.coordinate(0.0, 0.5, 0.5, 0.5));
        separated.put("high", ProfileFixtures.coordinate(1.0, 0.5, 0.5, 0.5));
        islands = ProfileFixtures.snapshot(properties, separated);
    }

    @Test
    void followsTheChainThroughTheGraph() {
        PathResult path = pathFinder.findPath(chain, "t0", "t4", 10);

        assertEquals(PathResult.Source.GRAPH, path.getSource());
        assertEquals(List.of("t0", "t1", "t2", "t3", "t4"), path.getTrackIds());
    }

    @Test
    void longPathsAreDownsampledKeepingEndpoints() {
        PathResult path = pathFinder.findPath(chain, "t0", "t4", 3);

        assertEquals(PathResult.Source.GRAPH, path.getSource());
        assertEquals(List.of("t0", "t2", "t4"), path.getTrackIds());
    }

    @Test
    void stepsBelowTwoAreRaisedToTwo() {
        PathResult path = pathFinder.findPath(chain, "t0", "t4", 1);

        assertEquals(List.of("t0", "t4"), path.getTrackIds());
    }

    @Test
    void disconnectedTracksGetAnInterpolatedPath() {
        PathResult path = pathFinder.findPath(islands, "low", "high", 3);

        assertEquals(PathResult.Source.INTERPOLATED, path.getSource());
        assertEquals(List.of("low", "mid", "high"), path.getTrackIds());
    }

    @Test
    void interpolatedPathNeverRepeatsTracks() {
        PathResult path = pathFinder.findPath(islands, "low", "high", 10);

        assertEquals("low", path.getTrackIds().get(0));
        assertEquals("high", path.getTrackIds().get(path.size() - 1));
        assertEquals(path.size(), new HashSet<>(path.getTrackIds()).size());
        assertTrue(path.size() <= 10);
    }

    @Test
    void unknownEndpointGivesDirectPath() {
        PathResult path = pathFinder.findPath(chain, "t0", "missing", 10);

        assertEquals(PathResult.Source.DIRECT, path.getSource());
        assertEquals(List.of("t0", "missing"), path.getTrackIds());
    }

    @Test
    void sameStartAndEndIsASingleTrack() {
        PathResult path = pathFinder.findPath(chain, "t2", "t2", 10);

        assertEquals(List.of("t2"), path.getTrackIds());
    }

    @Test
    void nearestTracksAreSortedByDistance() {
        List<TrackDistance> nearest = pathFinder.findNearest(chain, ProfileFixtures.coordinate(0.45, 0.5, 0.5, 0.5), 3);

        assertEquals(3, nearest.size());
        assertEquals("t2", nearest.get(0).getTrackId());
        assertEquals("t3", nearest.get(1).getTrackId());
        assertEquals("t1", nearest.get(2).getTrackId());
        assertEquals(0.05, nearest.get(0).getDistance(), 1e-9);
    }

    @Test
    void nearestHandlesDegenerateRequests() {
        EmotionalCoordinate target = ProfileFixtures.coordinate(0, 0, 0, 0);

        assertTrue(pathFinder.findNearest(chain, target, 0).isEmpty());
        assertTrue(pathFinder.findNearest(EmotionalSpaceSnapshot.empty(), target, 5).isEmpty());
        assertEquals(5, pathFinder.findNearest(chain, target, 50).size());
    }

    @Test
    void downsampleSpreadsIndicesEvenly() {
        List<String> path = List.of("a", "b", "c", "d", "e", "f", "g");

        assertEquals(List.of("a", "c", "e", "g"), EmotionalPathFinder.downsample(path, 4));
        assertEquals(List.of("a", "g"), EmotionalPathFinder.downsample(path, 2));
    }
}
