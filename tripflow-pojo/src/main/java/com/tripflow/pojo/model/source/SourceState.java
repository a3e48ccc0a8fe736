package com.tripflow.pojo.model.source;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceState {

    ACTIVE("active"),
    DEGRADED("degraded"),
    MISSING("missing");

    private final String code;

    SourceState(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
