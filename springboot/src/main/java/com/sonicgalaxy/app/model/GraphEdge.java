package com.sonicgalaxy.app.model;

import lombok.Value;

@Value
public class GraphEdge {
    String source;
    String target;
    double weight;
    double distance;
}
