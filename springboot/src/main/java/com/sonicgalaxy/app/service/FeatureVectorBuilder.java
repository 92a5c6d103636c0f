package com.sonicgalaxy.app.service;

import com.sonicgalaxy.app.dto.profile.SonicDnaProfile;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flattens a DNA profile into the fixed-width vector the embedding engine consumes.
 * <p>
 * Layout: valence, energy, complexity, tension, tempo / 200, then the harmonic (12),
 * timbral (13), textural (7), dynamic (10) and rhythmic (8) genes that are present.
 * Absent groups are skipped, not zero-filled in place, so the trailing padding absorbs them.
 */
@Component
public class FeatureVectorBuilder {

    public static final int FEATURE_LENGTH = 60;

    static final double TEMPO_SCALE = 200.0;

    static final int HARMONIC_SIZE = 12;
    static final int TIMBRAL_SIZE = 13;
    static final int TEXTURAL_SIZE = 7;
    static final int DYNAMIC_SIZE = 10;
    static final int RHYTHMIC_SIZE = 8;

    public double[] build(SonicDnaProfile profile) {
        double[] features = new double[FEATURE_LENGTH];
        int cursor = 0;

        features[cursor++] = profile.getValence();
        features[cursor++] = profile.getEnergy();
        features[cursor++] = profile.getComplexity();
        features[cursor++] = profile.getTension();
        features[cursor++] = profile.getTempo() / TEMPO_SCALE;

        cursor = append(features, cursor, profile.getHarmonicGenes(), HARMONIC_SIZE);
        cursor = append(features, cursor, profile.getTimbralGenes(), TIMBRAL_SIZE);
        cursor = append(features, cursor, profile.getTexturalGenes(), TEXTURAL_SIZE);
        cursor = append(features, cursor, profile.getDynamicGenes(), DYNAMIC_SIZE);
        append(features, cursor, profile.getRhythmicGenes(), RHYTHMIC_SIZE);

        return features;
    }

    private static int append(double[] features, int cursor, List<Double> genes, int groupSize) {
        if (genes == null || genes.isEmpty()) {
            return cursor;
        }
        int take = Math.min(groupSize, genes.size());
        for (int i = 0; i < take && cursor < features.length; i++) {
            Double gene = genes.get(i);
            features[cursor++] = gene != null ? gene : 0.0;
        }
        return cursor;
    }
}
