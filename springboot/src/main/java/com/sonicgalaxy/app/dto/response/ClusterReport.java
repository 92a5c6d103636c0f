package com.sonicgalaxy.app.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sonicgalaxy.app.model.Cluster;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterReport {

    @JsonProperty("total_tracks")
    private int totalTracks;

    @Builder.Default
    @JsonProperty("pca_explained_variance")
    private List<Double> pcaExplainedVariance = new ArrayList<>();

    // one row per track, in library order
    @Builder.Default
    @JsonProperty("pca_coordinates")
    private List<List<Double>> pcaCoordinates = new ArrayList<>();

    @Builder.Default
    private List<Cluster> clusters = new ArrayList<>();
}
