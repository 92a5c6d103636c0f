package com.sonicgalaxy.app.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sonicgalaxy.app.model.EmotionalCoordinate;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JourneyRequest {

    @NotBlank(message = "Start track is required")
    @JsonProperty("start_track")
    @JsonAlias("startTrack")
    private String startTrack;

    @NotBlank(message = "End track is required")
    @JsonProperty("end_track")
    @JsonAlias("endTrack")
    private String endTrack;

    private List<EmotionalCoordinate> waypoints;

    // seconds; falls back to the configured default when absent
    @Positive(message = "Duration must be positive")
    private Double duration;

    @Min(value = 2, message = "A journey needs at least 2 steps")
    @JsonProperty("max_steps")
    private Integer maxSteps;
}
