package com.sonicgalaxy.app.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrackPlacementResponse {

    @JsonProperty("track_id")
    private String trackId;

    // valence, energy, complexity, tension
    private Map<String, Double> coordinates;

    // x, y, z
    private Map<String, Double> position;

    private TrackMetadata metadata;
}
