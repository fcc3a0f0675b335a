package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Roadmap with technical fixes first in each phase, followed by narrative actions.
 */
public record MergedRoadmap(
        @JsonProperty("critical_immediate")  List<RoadmapEntry> criticalImmediate,
        @JsonProperty("high_priority")       List<RoadmapEntry> highPriority,
        @JsonProperty("medium_priority")     List<RoadmapEntry> mediumPriority,
        @JsonProperty("ongoing_maintenance") List<RoadmapEntry> ongoingMaintenance,
        @JsonProperty("roadmap_summary")     String roadmapSummary
) {
    public MergedRoadmap {
        criticalImmediate = List.copyOf(criticalImmediate);
        highPriority = List.copyOf(highPriority);
        mediumPriority = List.copyOf(mediumPriority);
        ongoingMaintenance = List.copyOf(ongoingMaintenance);
    }
}
