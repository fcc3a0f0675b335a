package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Additional findings surfaced by the scan-enhancement role.
 *
 * @param findings          violation-shaped findings; their kinds may or may not match scanner kinds
 * @param byCategory        finding descriptions grouped by regulation family
 * @param severityBreakdown count per severity label across {@code findings}
 * @param summary           free-text summary
 * @param source            strict, heuristic or default
 */
public record ScanEnhancement(
        @JsonProperty("findings")           List<Violation> findings,
        @JsonProperty("by_category")        Map<String, List<String>> byCategory,
        @JsonProperty("severity_breakdown") Map<String, Integer> severityBreakdown,
        @JsonProperty("summary")            String summary,
        @JsonProperty("source")             RecordSource source
) implements NarrativeRecord {

    public ScanEnhancement {
        findings = List.copyOf(findings);
        byCategory = Collections.unmodifiableMap(new LinkedHashMap<>(byCategory));
        severityBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(severityBreakdown));
    }

    @Override
    public NarratorRole role() {
        return NarratorRole.SCAN_ENHANCE;
    }

    @Override
    public String digest() {
        StringBuilder sb = new StringBuilder(summary);
        findings.stream().limit(3).forEach(f ->
                sb.append("\n- [").append(f.severity()).append("] ").append(f.kind()).append(": ").append(f.description()));
        return sb.toString();
    }
}
