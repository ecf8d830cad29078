package com.retail.herd.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    UP("up"),
    DOWN("down"),
    NONE("none");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
