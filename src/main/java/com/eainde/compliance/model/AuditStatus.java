package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditStatus {

    /** Technical stages and all four narrative roles succeeded. */
    COMPLETED("completed"),
    /** Technical stages succeeded, at least one narrative role did not. */
    PARTIAL("partial"),
    /** A technical stage failed; no report body. */
    FAILED("failed");

    private final String label;

    AuditStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
