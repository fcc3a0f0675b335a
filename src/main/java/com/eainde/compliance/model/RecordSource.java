package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance of a record, used by the merge step to deduplicate and trace where a finding came from.
 */
public enum RecordSource {

    TECHNICAL("technical"),
    NARRATIVE_STRICT("narrative-strict"),
    NARRATIVE_HEURISTIC("narrative-heuristic"),
    NARRATIVE_DEFAULT("narrative-default");

    private final String label;

    RecordSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isNarrative() {
        return this != TECHNICAL;
    }

    @Override
    public String toString() {
        return label;
    }
}
