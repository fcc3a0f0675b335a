package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ordered fixes for every distinct violation kind, grouped into delivery phases.
 *
 * @param fixes               one fix per distinct kind, in issue order
 * @param priorityOrder       distinct kinds, transport/consent first, presentation last
 * @param phases              kinds grouped by the urgency band of their most urgent issue
 * @param totalEstimatedHours sum of parsed fix efforts
 * @param estimatedTotalTime  {@code totalEstimatedHours} rendered as {@code "N hours"}
 */
public record RemediationPlan(
        @JsonProperty("fixes")                 List<RemediationFix> fixes,
        @JsonProperty("priority_order")        List<String> priorityOrder,
        @JsonProperty("phases")                Phases phases,
        @JsonProperty("total_estimated_hours") int totalEstimatedHours,
        @JsonProperty("estimated_total_time")  String estimatedTotalTime
) {

    public RemediationPlan {
        fixes = List.copyOf(fixes);
        priorityOrder = List.copyOf(priorityOrder);
    }

    public static RemediationPlan empty() {
        return new RemediationPlan(List.of(), List.of(), new Phases(List.of(), List.of(), List.of()), 0, "0 hours");
    }

    public record Phases(
            @JsonProperty("critical_immediate") List<String> criticalImmediate,
            @JsonProperty("high_priority")      List<String> highPriority,
            @JsonProperty("medium_priority")    List<String> mediumPriority
    ) {
        public Phases {
            criticalImmediate = List.copyOf(criticalImmediate);
            highPriority = List.copyOf(highPriority);
            mediumPriority = List.copyOf(mediumPriority);
        }
    }
}
