package com.sonicgalaxy.app.service;

import com.sonicgalaxy.app.dto.profile.SonicDnaProfile;
import com.sonicgalaxy.app.dto.response.TrackMetadata;
import com.sonicgalaxy.app.dto.response.TrackPlacementResponse;
import com.sonicgalaxy.app.model.EmotionalCoordinate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TrackPlacementMapperTest {

    private final TrackPlacementMapper mapper = new TrackPlacementMapper();

    @Test
    void keyAndModeAreIndexed() {
        SonicDnaProfile profile = SonicDnaProfile.builder()
                .trackId("t").tempo(101.5).keySignature("Bb").mode("Minor").build();

        TrackMetadata metadata = mapper.mapToMetadata(profile);

        assertEquals(10, metadata.getKey());
        assertEquals("Bb", metadata.getKeyName());
        assertEquals(0, metadata.getMode());
        assertEquals(101.5, metadata.getTempo());
    }

    @Test
    void missingKeyDefaultsToCMajor() {
        TrackMetadata metadata = mapper.mapToMetadata(SonicDnaProfile.builder().trackId("t").build());

        assertEquals(0, metadata.getKey());
        assertEquals("C", metadata.getKeyName());
        assertEquals(1, metadata.getMode());
        assertEquals("Major", metadata.getModeName());
    }

    @Test
    void placementWithoutProfileHasNoMetadata() {
        EmotionalCoordinate coordinate = EmotionalCoordinate.of(0.1, 0.2, 0.3, 0.4).withPosition(-5, 0, 25);

        TrackPlacementResponse placement = mapper.mapToTrackPlacement("t", coordinate, null);

        assertNull(placement.getMetadata());
        assertEquals(0.4, placement.getCoordinates().get("tension"));
        assertEquals(25.0, placement.getPosition().get("z"));
    }
}
