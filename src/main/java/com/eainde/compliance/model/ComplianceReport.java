package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts and the 0..100 compliance score for one audit.
 *
 * @param totalIssues       number of mapped issues
 * @param severityBreakdown count per severity label, always all four labels in rank order
 * @param categoryBreakdown count per regulation family, first-encounter order
 * @param complianceScore   100 minus severity penalties, clamped to [0, 100]
 */
public record ComplianceReport(
        @JsonProperty("total_issues")       int totalIssues,
        @JsonProperty("severity_breakdown") Map<String, Integer> severityBreakdown,
        @JsonProperty("category_breakdown") Map<String, Integer> categoryBreakdown,
        @JsonProperty("compliance_score")   int complianceScore
) {

    public ComplianceReport {
        severityBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(severityBreakdown));
        categoryBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(categoryBreakdown));
    }

    public int count(Severity severity) {
        return severityBreakdown.getOrDefault(severity.label(), 0);
    }

    /** A breakdown with every severity label present at zero, in rank order. */
    public static Map<String, Integer> emptySeverityBreakdown() {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            breakdown.put(severity.label(), 0);
        }
        return breakdown;
    }
}
