package com.sonicgalaxy.app.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sonicgalaxy.app.model.EmotionalCoordinate;
import com.sonicgalaxy.app.model.TransitionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JourneyPointResponse {

    @JsonProperty("track_id")
    private String trackId;

    private double timestamp;

    @JsonProperty("transition_type")
    private TransitionType transitionType;

    private EmotionalCoordinate coordinates;
}
