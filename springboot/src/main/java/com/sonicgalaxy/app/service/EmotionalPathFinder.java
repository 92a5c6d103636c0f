package com.sonicgalaxy.app.service;

import com.sonicgalaxy.app.model.EmotionalCoordinate;
import com.sonicgalaxy.app.model.GraphEdge;
import com.sonicgalaxy.app.model.PathResult;
import com.sonicgalaxy.app.model.SimilarityGraph;
import com.sonicgalaxy.app.model.TrackDistance;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Routes between tracks of one snapshot.
 * <p>
 * Graph routing minimizes the sum of {@code 1 / weight} over traversed edges, which is the
 * emotional distance of each hop plus the graph epsilon. Chains of close, strongly weighted
 * neighbors therefore win over long jumps.
 */
@Component
@Slf4j
public class EmotionalPathFinder {

    static final int MIN_STEPS = 2;

    public PathResult findPath(EmotionalSpaceSnapshot space, String start, String end, int maxSteps) {
        SimilarityGraph graph = space.getGraph();
        if (!graph.containsNode(start) || !graph.containsNode(end)) {
            log.debug("Path endpoints {} -> {} not both in graph, returning direct path", start, end);
            return PathResult.direct(start, end);
        }

        int steps = Math.max(MIN_STEPS, maxSteps);
        Optional<List<String>> shortest = shortestPath(graph, start, end);
        if (shortest.isEmpty()) {
            log.debug("No graph path {} -> {}, interpolating", start, end);
            return createInterpolatedPath(space, start, end, steps);
        }

        List<String> path = shortest.get();
        if (path.size() > steps) {
            path = downsample(path, steps);
        }
        return PathResult.graph(path);
    }

    /**
     * Walks a straight line from {@code start} to {@code end} in emotional space and picks the
     * nearest track at each of the {@code maxSteps - 2} interior stops. Tracks already on the
     * path, and {@code end} itself, are skipped so every id appears once.
     */
    public PathResult createInterpolatedPath(EmotionalSpaceSnapshot space, String start, String end, int maxSteps) {
        Optional<EmotionalCoordinate> startCoord = space.coordinate(start);
        Optional<EmotionalCoordinate> endCoord = space.coordinate(end);
        if (startCoord.isEmpty() || endCoord.isEmpty()) {
            return PathResult.direct(start, end);
        }

        int steps = Math.max(MIN_STEPS, maxSteps);
        List<String> path = new ArrayList<>();
        path.add(start);

        for (int i = 1; i < steps - 1; i++) {
            double t = (double) i / (steps - 1);
            EmotionalCoordinate target = startCoord.get().interpolate(endCoord.get(), t);
            List<TrackDistance> nearest = findNearest(space, target, 1);
            if (nearest.isEmpty()) {
                continue;
            }
            String candidate = nearest.get(0).getTrackId();
            if (!path.contains(candidate) && !candidate.equals(end)) {
                path.add(candidate);
            }
        }

        if (!end.equals(start)) {
            path.add(end);
        }
        return PathResult.interpolated(path);
    }

    /**
     * The {@code k} tracks closest to {@code target} by emotional distance, nearest first.
     * Equal distances keep library order.
     */
    public List<TrackDistance> findNearest(EmotionalSpaceSnapshot space, EmotionalCoordinate target, int k) {
        if (k <= 0 || target == null || space.isEmpty()) {
            return List.of();
        }
        List<TrackDistance> distances = new ArrayList<>(space.size());
        space.getCoordinates().forEach((trackId, coordinate) ->
                distances.add(new TrackDistance(trackId, target.distanceTo(coordinate))));
        distances.sort(Comparator.comparingDouble(TrackDistance::getDistance));
        return distances.size() > k ? List.copyOf(distances.subList(0, k)) : List.copyOf(distances);
    }

    /**
     * Evenly spaced selection of {@code steps} entries that always keeps the first and last.
     */
    static List<String> downsample(List<String> path, int steps) {
        int last = path.size() - 1;
        List<String> sampled = new ArrayList<>(steps);
        for (int i = 0; i < steps; i++) {
            int index = (int) ((long) i * last / (steps - 1));
            sampled.add(path.get(index));
        }
        return sampled;
    }

    private static Optional<List<String>> shortestPath(SimilarityGraph graph, String start, String end) {
        Map<String, Double> cost = new HashMap<>();
        Map<String, String> previous = new HashMap<>();
        Set<String> settled = new HashSet<>();
        PriorityQueue<QueueEntry> queue = new PriorityQueue<>(
                Comparator.comparingDouble(QueueEntry::getCost).thenComparingLong(QueueEntry::getSequence));

        long sequence = 0;
        cost.put(start, 0.0);
        queue.add(new QueueEntry(start, 0.0, sequence++));

        while (!queue.isEmpty()) {
            QueueEntry entry = queue.poll();
            if (!settled.add(entry.getNode())) {
                continue;
            }
            if (entry.getNode().equals(end)) {
                break;
            }
            for (Map.Entry<String, GraphEdge> neighbor : graph.neighbors(entry.getNode()).entrySet()) {
                String next = neighbor.getKey();
                if (settled.contains(next)) {
                    continue;
                }
                double candidate = entry.getCost() + 1.0 / neighbor.getValue().getWeight();
                Double known = cost.get(next);
                if (known == null || candidate < known) {
                    cost.put(next, candidate);
                    previous.put(next, entry.getNode());
                    queue.add(new QueueEntry(next, candidate, sequence++));
                }
            }
        }

        if (!settled.contains(end)) {
            return Optional.empty();
        }
        LinkedList<String> path = new LinkedList<>();
        for (String node = end; node != null; node = previous.get(node)) {
            path.addFirst(node);
        }
        return Optional.of(path);
    }

    @Value
    private static class QueueEntry {
        String node;
        double cost;
        long sequence;
    }
}
