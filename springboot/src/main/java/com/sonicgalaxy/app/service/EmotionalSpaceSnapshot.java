package com.sonicgalaxy.app.service;

import com.sonicgalaxy.app.dto.profile.SonicDnaProfile;
import com.sonicgalaxy.app.model.EmotionalCoordinate;
import com.sonicgalaxy.app.model.SimilarityGraph;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one rebuild produced: coordinates keyed by track id in library order, the
 * similarity graph and the profiles they came from. Never mutated after publication: the
 * maps are unmodifiable copies and the graph is frozen on construction.
 */
@Getter
public class EmotionalSpaceSnapshot {

    private static final EmotionalSpaceSnapshot EMPTY =
            new EmotionalSpaceSnapshot(Map.of(), new SimilarityGraph(), Map.of(), "none", null);

    private final Map<String, EmotionalCoordinate> coordinates;
    private final SimilarityGraph graph;
    private final Map<String, SonicDnaProfile> profiles;
    private final String embeddingStrategy;
    private final Instant builtAt;

    public EmotionalSpaceSnapshot(Map<String, EmotionalCoordinate> coordinates,
                                  SimilarityGraph graph,
                                  Map<String, SonicDnaProfile> profiles,
                                  String embeddingStrategy,
                                  Instant builtAt) {
        this.coordinates = Collections.unmodifiableMap(new LinkedHashMap<>(coordinates));
        this.graph = graph.freeze();
        this.profiles = Collections.unmodifiableMap(new LinkedHashMap<>(profiles));
        this.embeddingStrategy = embeddingStrategy;
        this.builtAt = builtAt;
    }

    public static EmotionalSpaceSnapshot empty() {
        return EMPTY;
    }

    public Optional<EmotionalCoordinate> coordinate(String trackId) {
        return trackId == null ? Optional.empty() : Optional.ofNullable(coordinates.get(trackId));
    }

    public Optional<SonicDnaProfile> profile(String trackId) {
        return trackId == null ? Optional.empty() : Optional.ofNullable(profiles.get(trackId));
    }

    public boolean isEmpty() {
        return coordinates.isEmpty();
    }

    public int size() {
        return coordinates.size();
    }
}
