package com.sonicgalaxy.app.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphSummary {

    @JsonProperty("node_count")
    private int nodeCount;

    @JsonProperty("edge_count")
    private int edgeCount;

    @JsonProperty("embedding_strategy")
    private String embeddingStrategy;
}
