package com.sonicgalaxy.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonicgalaxy.app.config.EmotionalSpaceProperties;
import com.sonicgalaxy.app.dto.response.ConnectionResponse;
import com.sonicgalaxy.app.dto.response.TrackPlacementResponse;
import com.sonicgalaxy.app.dto.response.VisualizationExport;
import com.sonicgalaxy.app.model.GraphEdge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Bulk export of the current space for the 3D galaxy view.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisualizationExportService {

    private final EmotionalSpaceService spaceService;
    private final EmotionalClusterAnalyzer clusterAnalyzer;
    private final TrackPlacementMapper placementMapper;
    private final EmotionalSpaceProperties properties;
    private final ObjectMapper objectMapper;

    public VisualizationExport buildExport() {
        return buildExport(properties.getExport().getMaxConnections());
    }

    public VisualizationExport buildExport(int maxConnections) {
        EmotionalSpaceSnapshot space = spaceService.snapshot();

        List<TrackPlacementResponse> tracks = space.getCoordinates().entrySet().stream()
                .map(entry -> placementMapper.mapToTrackPlacement(
                        entry.getKey(), entry.getValue(), space.getProfiles().get(entry.getKey())))
                .collect(Collectors.toList());

        List<ConnectionResponse> connections = space.getGraph().strongestEdges(maxConnections).stream()
                .map(this::mapToConnection)
                .collect(Collectors.toList());

        log.info("Exported {} strongest connections (out of {} total)",
                connections.size(), space.getGraph().edgeCount());

        return VisualizationExport.builder()
                .tracks(tracks)
                .connections(connections)
                .statistics(clusterAnalyzer.statistics(space))
                .clusters(clusterAnalyzer.clusters(space))
                .totalConnections(space.getGraph().edgeCount())
                .build();
    }

    public Path writeExport() {
        return writeExport(Path.of(properties.getExport().getFile()));
    }

    public Path writeExport(Path outputFile) {
        VisualizationExport export = buildExport();
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputFile.toFile(), export);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write visualization data to " + outputFile, e);
        }
        log.info("Exported visualization data to {}", outputFile);
        return outputFile;
    }

    private ConnectionResponse mapToConnection(GraphEdge edge) {
        return ConnectionResponse.builder()
                .source(edge.getSource())
                .target(edge.getTarget())
                .weight(edge.getWeight())
                .distance(edge.getDistance())
                .build();
    }
}
