package com.sonicgalaxy.app.service;

import com.sonicgalaxy.app.dto.profile.SonicDnaProfile;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureVectorBuilderTest {

    private final FeatureVectorBuilder builder = new FeatureVectorBuilder();

    @Test
    void scalarsLeadTheVector() {
        SonicDnaProfile profile = SonicDnaProfile.builder()
                .trackId("t1")
                .valence(0.5).energy(0.6).complexity(0.7).tension(0.8)
                .tempo(120.0)
                .build();

        double[] features = builder.build(profile);

        assertEquals(FeatureVectorBuilder.FEATURE_LENGTH, features.length);
        assertArrayEquals(new double[]{0.5, 0.6, 0.7, 0.8, 0.6}, Arrays.copyOf(features, 5), 1e-12);
        for (int i = 5; i < features.length; i++) {
            assertEquals(0.0, features[i], "no genes means zero padding at " + i);
        }
    }

    @Test
    void missingGroupIsSkippedAndLaterGroupsMoveUp() {
        SonicDnaProfile profile = SonicDnaProfile.builder()
                .trackId("t1")
                .harmonicGenes(Collections.nCopies(12, 1.0))
                .texturalGenes(Collections.nCopies(7, 2.0))
                .build();

        double[] features = builder.build(profile);

        for (int i = 5; i < 17; i++) {
            assertEquals(1.0, features[i]);
        }
        for (int i = 17; i < 24; i++) {
            assertEquals(2.0, features[i]);
        }
        assertEquals(0.0, features[24]);
    }

    @Test
    void oversizedGroupIsTruncatedAndNullGenesBecomeZero() {
        SonicDnaProfile profile = SonicDnaProfile.builder()
                .trackId("t1")
                .harmonicGenes(Collections.nCopies(20, 3.0))
                .timbralGenes(Arrays.asList(null, 4.0))
                .build();

        double[] features = builder.build(profile);

        assertEquals(3.0, features[16]);
        assertEquals(0.0, features[17]);
        assertEquals(4.0, features[18]);
        assertEquals(0.0, features[19]);
    }

    @Test
    void fullProfileFillsFiftyFiveSlots() {
        SonicDnaProfile profile = SonicDnaProfile.builder()
                .trackId("t1")
                .valence(1).energy(1).complexity(1).tension(1).tempo(200)
                .harmonicGenes(Collections.nCopies(12, 1.0))
                .timbralGenes(Collections.nCopies(13, 1.0))
                .texturalGenes(Collections.nCopies(7, 1.0))
                .dynamicGenes(Collections.nCopies(10, 1.0))
                .rhythmicGenes(List.of(1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0))
                .build();

        double[] features = builder.build(profile);

        assertEquals(55.0, Arrays.stream(features).sum(), 1e-12);
        assertEquals(0.0, features[55]);
    }
}
