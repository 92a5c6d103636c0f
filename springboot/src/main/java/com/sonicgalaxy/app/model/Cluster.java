package com.sonicgalaxy.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Cluster {
    String id;
    @JsonProperty("tracks")
    List<String> trackIds;

    @JsonProperty("center")
    EmotionalCoordinate centroid;

    public int getSize() {
        return trackIds.size();
    }
}
