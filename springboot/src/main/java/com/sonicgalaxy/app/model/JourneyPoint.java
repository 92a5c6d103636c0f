package com.sonicgalaxy.app.model;

import lombok.Builder;
import lombok.Value;

/**
 * One step of an emotional journey.
 */
@Value
@Builder
public class JourneyPoint {
    EmotionalCoordinate coordinate;
    String trackId;
    double timestamp;
    TransitionType transitionType;
}
