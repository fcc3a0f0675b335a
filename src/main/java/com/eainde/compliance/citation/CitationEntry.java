package com.eainde.compliance.citation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Citations and typical fix effort for one violation kind.
 */
public record CitationEntry(
        @JsonProperty("citations")        List<String> citations,
        @JsonProperty("estimated_effort") String estimatedEffort
) {
    public CitationEntry {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    /** First citation, or {@code null} when the entry has none. */
    public String primary() {
        return citations.isEmpty() ? null : citations.get(0);
    }
}
