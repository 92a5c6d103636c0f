package com.sonicgalaxy.app.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spread of the library over the four emotional dimensions, keyed by dimension name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmotionalStatistics {

    @JsonProperty("track_count")
    private int trackCount;

    @Builder.Default
    @JsonProperty("emotional_ranges")
    private Map<String, DimensionStatistics> emotionalRanges = new LinkedHashMap<>();

    @Builder.Default
    @JsonProperty("emotional_center")
    private Map<String, Double> emotionalCenter = new LinkedHashMap<>();

    @Builder.Default
    @JsonProperty("emotional_spread")
    private Map<String, Double> emotionalSpread = new LinkedHashMap<>();

    public static EmotionalStatistics empty() {
        return EmotionalStatistics.builder().trackCount(0).build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return trackCount == 0;
    }
}
