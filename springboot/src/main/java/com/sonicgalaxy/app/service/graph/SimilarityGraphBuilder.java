package com.sonicgalaxy.app.service.graph;

import com.sonicgalaxy.app.config.EmotionalSpaceProperties;
import com.sonicgalaxy.app.model.EmotionalCoordinate;
import com.sonicgalaxy.app.model.SimilarityGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Connects tracks whose raw emotional coordinates lie closer than the similarity threshold.
 * Embedded positions are not used here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimilarityGraphBuilder {

    private final EmotionalSpaceProperties properties;

    public SimilarityGraph build(Map<String, EmotionalCoordinate> coordinates) {
        double threshold = properties.getGraph().getSimilarityThreshold();
        double epsilon = properties.getGraph().getEpsilon();

        SimilarityGraph graph = new SimilarityGraph();
        List<String> trackIds = new ArrayList<>(coordinates.keySet());
        trackIds.forEach(graph::addNode);

        for (int i = 0; i < trackIds.size(); i++) {
            EmotionalCoordinate first = coordinates.get(trackIds.get(i));
            for (int j = i + 1; j < trackIds.size(); j++) {
                double distance = first.distanceTo(coordinates.get(trackIds.get(j)));
                if (distance < threshold && distance > epsilon) {
                    graph.addEdge(trackIds.get(i), trackIds.get(j), 1.0 / (distance + epsilon), distance);
                }
            }
        }

        log.info("Built emotional graph with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
        return graph.freeze();
    }
}
