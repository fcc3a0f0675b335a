package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Regulatory background produced by the legal-context role.
 */
public record LegalContext(
        @JsonProperty("recent_updates")        List<String> recentUpdates,
        @JsonProperty("relevant_regulations")  List<String> relevantRegulations,
        @JsonProperty("enforcement_trends")    List<String> enforcementTrends,
        @JsonProperty("compliance_deadlines")  List<String> complianceDeadlines,
        @JsonProperty("regional_variations")   List<String> regionalVariations,
        @JsonProperty("update_summary")        String updateSummary,
        @JsonProperty("source")                RecordSource source
) implements NarrativeRecord {

    public LegalContext {
        recentUpdates = List.copyOf(recentUpdates);
        relevantRegulations = List.copyOf(relevantRegulations);
        enforcementTrends = List.copyOf(enforcementTrends);
        complianceDeadlines = List.copyOf(complianceDeadlines);
        regionalVariations = List.copyOf(regionalVariations);
    }

    @Override
    public NarratorRole role() {
        return NarratorRole.LEGAL_CONTEXT;
    }

    @Override
    public String summary() {
        return updateSummary;
    }

    @Override
    public String digest() {
        StringBuilder sb = new StringBuilder(updateSummary);
        relevantRegulations.stream().limit(3).forEach(r -> sb.append("\n- regulation: ").append(r));
        enforcementTrends.stream().limit(2).forEach(t -> sb.append("\n- enforcement: ").append(t));
        return sb.toString();
    }
}
