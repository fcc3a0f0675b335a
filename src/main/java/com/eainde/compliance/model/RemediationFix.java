package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Step-by-step fix for one violation kind.
 */
public record RemediationFix(
        @JsonProperty("issue_kind")       String issueKind,
        @JsonProperty("title")            String title,
        @JsonProperty("description")      String description,
        @JsonProperty("example")          String example,
        @JsonProperty("steps")            List<String> steps,
        @JsonProperty("validation")       String validation,
        @JsonProperty("estimated_effort") String estimatedEffort
) {
    public RemediationFix {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
