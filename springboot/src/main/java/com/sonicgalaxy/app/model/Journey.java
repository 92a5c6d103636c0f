package com.sonicgalaxy.app.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Journey {
    String startTrackId;
    String endTrackId;
    double durationSeconds;
    PathResult.Source pathSource;
    List<JourneyPoint> points;
}
