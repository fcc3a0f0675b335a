package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Technical stages whose failure aborts an audit. */
public enum PipelineStage {
    SCAN,
    MAP,
    PLAN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
