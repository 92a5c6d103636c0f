package com.sonicgalaxy.app.service;

import com.sonicgalaxy.app.dto.profile.SonicDnaProfile;
import com.sonicgalaxy.app.dto.response.TrackMetadata;
import com.sonicgalaxy.app.dto.response.TrackPlacementResponse;
import com.sonicgalaxy.app.model.EmotionalCoordinate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class TrackPlacementMapper {

    private static final Map<String, Integer> KEY_INDEX = Map.ofEntries(
            Map.entry("C", 0), Map.entry("C#", 1), Map.entry("Db", 1),
            Map.entry("D", 2), Map.entry("D#", 3), Map.entry("Eb", 3),
            Map.entry("E", 4), Map.entry("F", 5), Map.entry("F#", 6),
            Map.entry("Gb", 6), Map.entry("G", 7), Map.entry("G#", 8),
            Map.entry("Ab", 8), Map.entry("A", 9), Map.entry("A#", 10),
            Map.entry("Bb", 10), Map.entry("B", 11));

    public TrackPlacementResponse mapToTrackPlacement(String trackId, EmotionalCoordinate coordinate,
                                                      SonicDnaProfile profile) {
        Map<String, Double> emotional = new LinkedHashMap<>();
        emotional.put("valence", coordinate.getValence());
        emotional.put("energy", coordinate.getEnergy());
        emotional.put("complexity", coordinate.getComplexity());
        emotional.put("tension", coordinate.getTension());

        Map<String, Double> position = new LinkedHashMap<>();
        position.put("x", coordinate.getX());
        position.put("y", coordinate.getY());
        position.put("z", coordinate.getZ());

        return TrackPlacementResponse.builder()
                .trackId(trackId)
                .coordinates(emotional)
                .position(position)
                .metadata(profile != null ? mapToMetadata(profile) : null)
                .build();
    }

    TrackMetadata mapToMetadata(SonicDnaProfile profile) {
        String keyName = StringUtils.hasText(profile.getKeySignature()) ? profile.getKeySignature().trim() : "C";
        String modeName = StringUtils.hasText(profile.getMode()) ? profile.getMode().trim() : "Major";

        return TrackMetadata.builder()
                .tempo(profile.getTempo())
                .key(KEY_INDEX.getOrDefault(keyName, 0))
                .keyName(keyName)
                .mode("major".equalsIgnoreCase(modeName) ? 1 : 0)
                .modeName(modeName)
                .geneticFingerprint(profile.getGeneticFingerprint())
                .build();
    }
}
