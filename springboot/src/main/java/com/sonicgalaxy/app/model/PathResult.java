package com.sonicgalaxy.app.model;

import lombok.Value;

import java.util.List;

/**
 * Ordered track ids between two tracks, tagged with the branch that produced them.
 */
@Value
public class PathResult {

    public enum Source {
        /** Shortest path through the similarity graph. */
        GRAPH,
        /** Nearest tracks along a straight line in emotional space. */
        INTERPOLATED,
        /** Start, the nearest track to each waypoint, end. */
        WAYPOINTS,
        /** An endpoint is unknown; just the two ids. */
        DIRECT
    }

    Source source;
    List<String> trackIds;

    public static PathResult graph(List<String> trackIds) {
        return new PathResult(Source.GRAPH, List.copyOf(trackIds));
    }

    public static PathResult interpolated(List<String> trackIds) {
        return new PathResult(Source.INTERPOLATED, List.copyOf(trackIds));
    }

    public static PathResult waypoints(List<String> trackIds) {
        return new PathResult(Source.WAYPOINTS, List.copyOf(trackIds));
    }

    public static PathResult direct(String start, String end) {
        return new PathResult(Source.DIRECT, List.of(start, end));
    }

    public int size() {
        return trackIds.size();
    }
}
