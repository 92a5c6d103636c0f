package com.sonicgalaxy.app.service;

import com.sonicgalaxy.app.config.EmotionalSpaceProperties;
import com.sonicgalaxy.app.dto.profile.SonicDnaProfile;
import com.sonicgalaxy.app.dto.request.JourneyRequest;
import com.sonicgalaxy.app.dto.response.ClusterReport;
import com.sonicgalaxy.app.dto.response.EmotionalStatistics;
import com.sonicgalaxy.app.dto.response.GraphSummary;
import com.sonicgalaxy.app.dto.response.JourneyPointResponse;
import com.sonicgalaxy.app.dto.response.JourneyResponse;
import com.sonicgalaxy.app.dto.response.TrackPlacementResponse;
import com.sonicgalaxy.app.exception.InvalidFeatureSetException;
import com.sonicgalaxy.app.model.EmotionalCoordinate;
import com.sonicgalaxy.app.model.Journey;
import com.sonicgalaxy.app.model.PathResult;
import com.sonicgalaxy.app.model.SimilarityGraph;
import com.sonicgalaxy.app.model.TrackDistance;
import com.sonicgalaxy.app.service.embedding.EmbeddingEngine;
import com.sonicgalaxy.app.service.embedding.EmbeddingResult;
import com.sonicgalaxy.app.service.graph.SimilarityGraphBuilder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owner of the emotional space: the coordinate cache and the similarity graph.
 * <p>
 * {@link #rebuild(List)} replaces both wholesale and publishes them as one immutable
 * snapshot, so queries never see a half-built space. Rebuilds are serialized; queries run
 * concurrently against whichever snapshot was current when they started.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class EmotionalSpaceService {

    private final EmotionalSpaceProperties properties;
    private final FeatureVectorBuilder featureVectorBuilder;
    private final EmbeddingEngine embeddingEngine;
    private final SimilarityGraphBuilder graphBuilder;
    private final EmotionalPathFinder pathFinder;
    private final JourneySynthesizer journeySynthesizer;
    private final EmotionalClusterAnalyzer clusterAnalyzer;
    private final TrackPlacementMapper placementMapper;

    private volatile EmotionalSpaceSnapshot snapshot = EmotionalSpaceSnapshot.empty();

    public synchronized EmotionalSpaceSnapshot rebuild(List<SonicDnaProfile> profiles) {
        long startTime = System.currentTimeMillis();
        validateProfiles(profiles);
        log.info("Building emotional space from {} tracks", profiles.size());

        List<double[]> features = new ArrayList<>(profiles.size());
        for (SonicDnaProfile profile : profiles) {
            features.add(featureVectorBuilder.build(profile));
        }

        EmbeddingResult embedding = embeddingEngine.embed(features);
        double[][] positions = embedding.getPositions();

        Map<String, EmotionalCoordinate> coordinates = new LinkedHashMap<>();
        Map<String, SonicDnaProfile> byId = new LinkedHashMap<>();
        for (int i = 0; i < profiles.size(); i++) {
            SonicDnaProfile profile = profiles.get(i);
            EmotionalCoordinate coordinate = EmotionalCoordinate.of(
                            profile.getValence(), profile.getEnergy(), profile.getComplexity(), profile.getTension())
                    .withPosition(positions[i][0], positions[i][1], positions[i][2]);
            coordinates.put(profile.getTrackId(), coordinate);
            byId.put(profile.getTrackId(), profile);
        }

        SimilarityGraph graph = graphBuilder.build(coordinates);
        EmotionalSpaceSnapshot built = new EmotionalSpaceSnapshot(
                coordinates, graph, byId, embedding.getStrategy(), Instant.now());
        snapshot = built;

        log.info("Emotional space ready. Tracks: {}, Edges: {}, Strategy: {}{}, Time: {}ms",
                built.size(), graph.edgeCount(), embedding.getStrategy(),
                embedding.isDegraded() ? " (fallback)" : "",
                System.currentTimeMillis() - startTime);
        return built;
    }

    public EmotionalSpaceSnapshot snapshot() {
        return snapshot;
    }

    public Optional<EmotionalCoordinate> getCoordinate(String trackId) {
        return snapshot.coordinate(trackId);
    }

    public List<TrackDistance> findNearest(@NotNull EmotionalCoordinate target, int k) {
        return pathFinder.findNearest(snapshot, target, k);
    }

    public PathResult findPath(String startTrack, String endTrack, int maxSteps) {
        return pathFinder.findPath(snapshot, startTrack, endTrack, maxSteps);
    }

    public PathResult findPath(String startTrack, String endTrack) {
        return findPath(startTrack, endTrack, properties.getJourney().getDefaultMaxSteps());
    }

    public JourneyResponse createJourney(@Valid @NotNull JourneyRequest request) {
        double duration = request.getDuration() != null
                ? request.getDuration()
                : properties.getJourney().getDefaultDurationSeconds();
        int maxSteps = request.getMaxSteps() != null
                ? request.getMaxSteps()
                : properties.getJourney().getDefaultMaxSteps();

        Journey journey = journeySynthesizer.createJourney(
                snapshot, request.getStartTrack(), request.getEndTrack(), request.getWaypoints(), duration, maxSteps);
        return mapToJourneyResponse(journey);
    }

    public EmotionalStatistics statistics() {
        return clusterAnalyzer.statistics(snapshot);
    }

    public ClusterReport clusters() {
        return clusterAnalyzer.clusters(snapshot);
    }

    public GraphSummary graphSummary() {
        EmotionalSpaceSnapshot current = snapshot;
        return GraphSummary.builder()
                .nodeCount(current.getGraph().nodeCount())
                .edgeCount(current.getGraph().edgeCount())
                .embeddingStrategy(current.getEmbeddingStrategy())
                .build();
    }

    /**
     * Tracks within {@code tolerance} of every given dimension; null dimensions are not
     * constrained. Tension is not filterable.
     */
    public List<TrackPlacementResponse> filterTracks(Double valence, Double energy, Double complexity,
                                                     Double tolerance) {
        double limit = tolerance != null ? tolerance : properties.getFilterTolerance();
        EmotionalSpaceSnapshot current = snapshot;

        return current.getCoordinates().entrySet().stream()
                .filter(entry -> within(entry.getValue().getValence(), valence, limit))
                .filter(entry -> within(entry.getValue().getEnergy(), energy, limit))
                .filter(entry -> within(entry.getValue().getComplexity(), complexity, limit))
                .map(entry -> placementMapper.mapToTrackPlacement(
                        entry.getKey(), entry.getValue(), current.getProfiles().get(entry.getKey())))
                .collect(Collectors.toList());
    }

    private static boolean within(double value, Double target, double tolerance) {
        return target == null || Math.abs(value - target) <= tolerance;
    }

    private JourneyResponse mapToJourneyResponse(Journey journey) {
        List<JourneyPointResponse> points = journey.getPoints().stream()
                .map(point -> JourneyPointResponse.builder()
                        .trackId(point.getTrackId())
                        .timestamp(point.getTimestamp())
                        .transitionType(point.getTransitionType())
                        .coordinates(point.getCoordinate())
                        .build())
                .collect(Collectors.toList());

        return JourneyResponse.builder()
                .startTrack(journey.getStartTrackId())
                .endTrack(journey.getEndTrackId())
                .duration(journey.getDurationSeconds())
                .pathSource(journey.getPathSource())
                .path(points)
                .build();
    }

    private static void validateProfiles(List<SonicDnaProfile> profiles) {
        if (CollectionUtils.isEmpty(profiles)) {
            throw new InvalidFeatureSetException("No tracks available for emotional mapping");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < profiles.size(); i++) {
            SonicDnaProfile profile = profiles.get(i);
            if (profile == null || !StringUtils.hasText(profile.getTrackId())) {
                throw new InvalidFeatureSetException("Profile at index " + i + " has no track id");
            }
            if (!seen.add(profile.getTrackId())) {
                throw new InvalidFeatureSetException("Duplicate track id " + profile.getTrackId());
            }
        }
    }
}
