package com.sonicgalaxy.app.service.embedding;

import lombok.Value;

@Value
public class EmbeddingResult {
    double[][] positions;
    String strategy;
    boolean degraded;
}
