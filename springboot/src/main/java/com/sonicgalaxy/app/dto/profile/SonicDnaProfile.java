package com.sonicgalaxy.app.dto.profile;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Sonic DNA of a single track as delivered by the audio analysis pipeline.
 * Every gene group is optional; a null or empty list means the analyzer did not produce it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SonicDnaProfile {

    @JsonProperty("track_id")
    @JsonAlias("trackId")
    private String trackId;

    private double valence;     // -1.0 to 1.0
    private double energy;      // 0.0-1.0
    private double complexity;  // 0.0-1.0
    private double tension;     // 0.0-1.0

    private double tempo;       // BPM

    @JsonProperty("harmonic_genes")
    private List<Double> harmonicGenes;  // 12-bin chroma

    @JsonProperty("timbral_genes")
    private List<Double> timbralGenes;   // 13 MFCC means

    @JsonProperty("textural_genes")
    private List<Double> texturalGenes;  // 7 spectral contrast bands

    @JsonProperty("dynamic_genes")
    private List<Double> dynamicGenes;   // energy envelope stats

    @JsonProperty("rhythmic_genes")
    private List<Double> rhythmicGenes;  // onset pattern

    @JsonProperty("key_signature")
    private String keySignature;

    private String mode; // Major / Minor

    @JsonProperty("file_hash")
    private String fileHash;

    @JsonProperty("analysis_version")
    private String analysisVersion;

    /**
     * Short hex digest of all gene values, stable for identical genes. The digest input is the
     * gene list written the way the analysis pipeline prints it ({@code [0.5, 1e-05, 120.0]}),
     * so both sides produce the same fingerprint for the same genes.
     */
    @JsonIgnore
    public String getGeneticFingerprint() {
        String combined = Stream.of(harmonicGenes, rhythmicGenes, timbralGenes, texturalGenes, dynamicGenes)
                .filter(genes -> genes != null)
                .flatMap(List::stream)
                .map(SonicDnaProfile::geneText)
                .collect(Collectors.joining(", ", "[", "]"));
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(combined.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // shortest round-trip digits, scientific below 1e-4 and from 1e16 on
    static String geneText(Double value) {
        if (value == null) {
            return "None";
        }
        double v = value;
        if (Double.isNaN(v)) {
            return "nan";
        }
        if (Double.isInfinite(v)) {
            return v > 0 ? "inf" : "-inf";
        }
        if (v == 0.0) {
            return 1.0 / v < 0 ? "-0.0" : "0.0";
        }

        BigDecimal decimal = new BigDecimal(Double.toString(v)).stripTrailingZeros();
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent >= -4 && exponent < 16) {
            String plain = decimal.toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }

        String digits = decimal.unscaledValue().abs().toString();
        StringBuilder text = new StringBuilder(v < 0 ? "-" : "");
        text.append(digits.charAt(0));
        if (digits.length() > 1) {
            text.append('.').append(digits, 1, digits.length());
        }
        text.append('e').append(exponent < 0 ? '-' : '+');
        if (Math.abs(exponent) < 10) {
            text.append('0');
        }
        return text.append(Math.abs(exponent)).toString();
    }
}
