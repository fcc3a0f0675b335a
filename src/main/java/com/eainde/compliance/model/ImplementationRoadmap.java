package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Phased plan produced by the roadmap role.
 */
public record ImplementationRoadmap(
        @JsonProperty("immediate")           List<RoadmapAction> immediate,
        @JsonProperty("short_term")          List<RoadmapAction> shortTerm,
        @JsonProperty("long_term")           List<RoadmapAction> longTerm,
        @JsonProperty("ongoing_maintenance") List<RoadmapAction> ongoingMaintenance,
        @JsonProperty("roadmap_summary")     String roadmapSummary,
        @JsonProperty("source")              RecordSource source
) implements NarrativeRecord {

    public ImplementationRoadmap {
        immediate = List.copyOf(immediate);
        shortTerm = List.copyOf(shortTerm);
        longTerm = List.copyOf(longTerm);
        ongoingMaintenance = List.copyOf(ongoingMaintenance);
    }

    @Override
    public NarratorRole role() {
        return NarratorRole.ROADMAP;
    }

    @Override
    public String summary() {
        return roadmapSummary;
    }

    public int actionCount() {
        return immediate.size() + shortTerm.size() + longTerm.size() + ongoingMaintenance.size();
    }

    @Override
    public String digest() {
        StringBuilder sb = new StringBuilder(roadmapSummary);
        immediate.stream().limit(3).forEach(a -> sb.append("\n- immediate: ").append(a.action()));
        return sb.toString();
    }
}
