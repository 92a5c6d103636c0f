package com.sonicgalaxy.app.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything a 3D view needs in one document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisualizationExport {
    private List<TrackPlacementResponse> tracks;
    private List<ConnectionResponse> connections;
    private EmotionalStatistics statistics;
    private ClusterReport clusters;

    @JsonProperty("total_connections")
    private int totalConnections;
}
