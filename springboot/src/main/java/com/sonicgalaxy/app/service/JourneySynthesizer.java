package com.sonicgalaxy.app.service;

import com.sonicgalaxy.app.config.EmotionalSpaceProperties;
import com.sonicgalaxy.app.model.EmotionalCoordinate;
import com.sonicgalaxy.app.model.Journey;
import com.sonicgalaxy.app.model.JourneyPoint;
import com.sonicgalaxy.app.model.PathResult;
import com.sonicgalaxy.app.model.TrackDistance;
import com.sonicgalaxy.app.model.TransitionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a route into a timed journey. Waypoints, when given, replace the graph route with
 * start, the nearest track to each waypoint, and end.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JourneySynthesizer {

    private final EmotionalPathFinder pathFinder;
    private final EmotionalSpaceProperties properties;

    public Journey createJourney(EmotionalSpaceSnapshot space, String start, String end,
                                 List<EmotionalCoordinate> waypoints, double durationSeconds, int maxSteps) {
        PathResult path = CollectionUtils.isEmpty(waypoints)
                ? pathFinder.findPath(space, start, end, maxSteps)
                : incorporateWaypoints(space, start, end, waypoints);

        // ids without a cached coordinate cannot be placed on the timeline
        List<String> placed = new ArrayList<>(path.size());
        List<EmotionalCoordinate> coordinates = new ArrayList<>(path.size());
        for (String trackId : path.getTrackIds()) {
            space.coordinate(trackId).ifPresent(coordinate -> {
                placed.add(trackId);
                coordinates.add(coordinate);
            });
        }
        if (placed.size() < path.size()) {
            log.warn("Dropped {} unknown tracks from journey {} -> {}", path.size() - placed.size(), start, end);
        }

        int total = placed.size();
        List<JourneyPoint> points = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            points.add(JourneyPoint.builder()
                    .trackId(placed.get(i))
                    .coordinate(coordinates.get(i))
                    .timestamp(timestamp(i, total, durationSeconds))
                    .transitionType(transitionType(placed, coordinates, i, start, end))
                    .build());
        }

        log.info("Created {} journey {} -> {} with {} points over {}s",
                path.getSource(), start, end, total, durationSeconds);

        return Journey.builder()
                .startTrackId(start)
                .endTrackId(end)
                .durationSeconds(durationSeconds)
                .pathSource(path.getSource())
                .points(List.copyOf(points))
                .build();
    }

    PathResult incorporateWaypoints(EmotionalSpaceSnapshot space, String start, String end,
                                    List<EmotionalCoordinate> waypoints) {
        List<String> enhanced = new ArrayList<>();
        enhanced.add(start);
        for (EmotionalCoordinate waypoint : waypoints) {
            List<TrackDistance> nearest = pathFinder.findNearest(space, waypoint, 1);
            if (nearest.isEmpty()) {
                continue;
            }
            String trackId = nearest.get(0).getTrackId();
            if (!enhanced.contains(trackId) && !trackId.equals(end)) {
                enhanced.add(trackId);
            }
        }
        if (!end.equals(start)) {
            enhanced.add(end);
        }
        return PathResult.waypoints(enhanced);
    }

    static double timestamp(int index, int total, double durationSeconds) {
        if (total <= 1) {
            return 0.0;
        }
        return (double) index / (total - 1) * durationSeconds;
    }

    /**
     * Endpoints are tagged by role first: when an unknown id was dropped, the surviving
     * {@code end} track keeps its END tag even as the only point.
     */
    TransitionType transitionType(List<String> trackIds, List<EmotionalCoordinate> path, int index,
                                  String start, String end) {
        int last = path.size() - 1;
        String trackId = trackIds.get(index);
        if (index == 0 && trackId.equals(start)) {
            return TransitionType.START;
        }
        if (index == last && trackId.equals(end)) {
            return TransitionType.END;
        }
        if (index == 0) {
            return TransitionType.START;
        }
        if (index == last) {
            return TransitionType.END;
        }
        return isBridge(path.get(index - 1), path.get(index), path.get(index + 1))
                ? TransitionType.BRIDGE
                : TransitionType.SMOOTH;
    }

    /**
     * A track bridges its neighbors when going through it is shorter than a scaled-down
     * direct jump between them.
     */
    boolean isBridge(EmotionalCoordinate previous, EmotionalCoordinate current, EmotionalCoordinate next) {
        return isBridge(previous.distanceTo(current), current.distanceTo(next), previous.distanceTo(next));
    }

    boolean isBridge(double previousToCurrent, double currentToNext, double previousToNext) {
        return previousToCurrent + currentToNext < previousToNext * properties.getJourney().getBridgeThreshold();
    }
}
