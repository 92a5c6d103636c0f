package com.sonicgalaxy.app.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sonicgalaxy.app.model.PathResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JourneyResponse {

    @JsonProperty("start_track")
    private String startTrack;

    @JsonProperty("end_track")
    private String endTrack;

    private double duration;

    @JsonProperty("path_source")
    private PathResult.Source pathSource;

    private List<JourneyPointResponse> path;
}
