package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Mapped issues partitioned by severity, each bucket in fix-priority order.
 */
public record PriorityMatrix(
        @JsonProperty("critical_immediate") List<MappedIssue> criticalImmediate,
        @JsonProperty("high_priority")      List<MappedIssue> highPriority,
        @JsonProperty("medium_priority")    List<MappedIssue> mediumPriority,
        @JsonProperty("low_priority")       List<MappedIssue> lowPriority
) {

    public PriorityMatrix {
        criticalImmediate = List.copyOf(criticalImmediate);
        highPriority = List.copyOf(highPriority);
        mediumPriority = List.copyOf(mediumPriority);
        lowPriority = List.copyOf(lowPriority);
    }

    public static PriorityMatrix of(List<MappedIssue> issues) {
        return new PriorityMatrix(
                bucket(issues, Severity.CRITICAL),
                bucket(issues, Severity.HIGH),
                bucket(issues, Severity.MEDIUM),
                bucket(issues, Severity.LOW));
    }

    public int size() {
        return criticalImmediate.size() + highPriority.size() + mediumPriority.size() + lowPriority.size();
    }

    private static List<MappedIssue> bucket(List<MappedIssue> issues, Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).toList();
    }
}
