package com.sonicgalaxy.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TransitionType {
    START,
    END,
    BRIDGE,
    SMOOTH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
