package com.sonicgalaxy.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class TrackDistance {
    @JsonProperty("track_id")
    String trackId;
    double distance;
}
