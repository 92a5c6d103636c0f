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
public class TrackMetadata {
    private double tempo;
    private int key;

    @JsonProperty("key_name")
    private String keyName;

    private int mode;

    @JsonProperty("mode_name")
    private String modeName;

    @JsonProperty("genetic_fingerprint")
    private String geneticFingerprint;
}
