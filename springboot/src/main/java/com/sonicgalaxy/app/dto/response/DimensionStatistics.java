package com.sonicgalaxy.app.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DimensionStatistics {
    private double min;
    private double max;
    private double mean;
    private double std;
}
