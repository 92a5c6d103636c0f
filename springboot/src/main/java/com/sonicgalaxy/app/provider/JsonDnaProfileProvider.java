package com.sonicgalaxy.app.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonicgalaxy.app.config.EmotionalSpaceProperties;
import com.sonicgalaxy.app.dto.profile.SonicDnaProfile;
import com.sonicgalaxy.app.exception.DnaProfileLoadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the profile store written by the analysis pipeline: one JSON object keyed by
 * track id, each value a profile with snake_case fields.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonDnaProfileProvider implements DnaProfileProvider {

    private static final TypeReference<LinkedHashMap<String, SonicDnaProfile>> STORE_TYPE =
            new TypeReference<>() {
            };

    private final ObjectMapper objectMapper;
    private final EmotionalSpaceProperties properties;

    @Override
    public List<SonicDnaProfile> loadProfiles() {
        return loadProfiles(Path.of(properties.getStore().getFile()));
    }

    public List<SonicDnaProfile> loadProfiles(Path storeFile) {
        if (!Files.exists(storeFile)) {
            log.warn("DNA profile store not found at {}", storeFile.toAbsolutePath());
            return List.of();
        }

        Map<String, SonicDnaProfile> stored;
        try {
            stored = objectMapper.readValue(storeFile.toFile(), STORE_TYPE);
        } catch (IOException e) {
            throw new DnaProfileLoadException("Failed to read DNA profiles from " + storeFile, e);
        }

        if (stored == null) {
            return List.of();
        }

        List<SonicDnaProfile> profiles = new ArrayList<>(stored.size());
        stored.forEach((trackId, profile) -> {
            if (profile == null) {
                log.warn("Skipping empty profile entry for track {}", trackId);
                return;
            }
            if (profile.getTrackId() == null || profile.getTrackId().isBlank()) {
                profile.setTrackId(trackId);
            }
            profiles.add(profile);
        });

        log.info("Loaded {} DNA profiles from {}", profiles.size(), storeFile);
        return profiles;
    }
}
