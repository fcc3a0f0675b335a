package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four narrative roles, in the order the orchestrator consults them.
 */
public enum NarratorRole {

    SCAN_ENHANCE("scan_enhance"),
    LEGAL_CONTEXT("legal_context"),
    RISK_ASSESSMENT("risk_assessment"),
    ROADMAP("roadmap");

    private final String wireName;

    NarratorRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
