package com.sonicgalaxy.app.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Undirected weighted graph over track ids. Nodes and edges keep insertion order,
 * which is what makes weight ranking ties and neighbor iteration reproducible.
 * <p>
 * After {@link #freeze()} the graph is read-only and any further mutation throws
 * {@link IllegalStateException}.
 */
public class SimilarityGraph {

    private final Map<String, Map<String, GraphEdge>> adjacency = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private boolean frozen;

    public void addNode(String trackId) {
        checkMutable();
        adjacency.computeIfAbsent(trackId, id -> new LinkedHashMap<>());
    }

    public void addEdge(String source, String target, double weight, double distance) {
        checkMutable();
        if (source.equals(target)) {
            throw new IllegalArgumentException("Self-loop on " + source);
        }
        if (!(weight > 0)) {
            throw new IllegalArgumentException("Edge weight must be positive, got " + weight);
        }
        addNode(source);
        addNode(target);
        if (adjacency.get(source).containsKey(target)) {
            return;
        }
        GraphEdge edge = new GraphEdge(source, target, weight, distance);
        adjacency.get(source).put(target, edge);
        adjacency.get(target).put(source, edge);
        edges.add(edge);
    }

    public SimilarityGraph freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean containsNode(String trackId) {
        return trackId != null && adjacency.containsKey(trackId);
    }

    public Set<String> nodes() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    /**
     * Neighbors of a node mapped to the connecting edge; empty for unknown nodes.
     */
    public Map<String, GraphEdge> neighbors(String trackId) {
        Map<String, GraphEdge> adjacent = adjacency.get(trackId);
        return adjacent == null ? Map.of() : Collections.unmodifiableMap(adjacent);
    }

    public List<GraphEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Edges sorted by descending weight, ties kept in insertion order, capped at {@code limit}.
     */
    public List<GraphEdge> strongestEdges(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<GraphEdge> sorted = new ArrayList<>(edges);
        // List.sort is stable
        sorted.sort(Comparator.comparingDouble(GraphEdge::getWeight).reversed());
        return sorted.size() > limit ? List.copyOf(sorted.subList(0, limit)) : List.copyOf(sorted);
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Similarity graph is frozen; rebuild the space instead");
        }
    }
}
