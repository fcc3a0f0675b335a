package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Risk view combining the technical severity distribution (authoritative for the level)
 * with the narrative's qualitative factors and penalties.
 *
 * @param overallRiskLevel     derived from technical counts only
 * @param narrativeRiskLevel   level the narrative role proposed, informational
 */
public record MergedRiskAssessment(
        @JsonProperty("overall_risk_level")    String overallRiskLevel,
        @JsonProperty("narrative_risk_level")  String narrativeRiskLevel,
        @JsonProperty("severity_distribution") Map<String, Integer> severityDistribution,
        @JsonProperty("compliance_score")      int complianceScore,
        @JsonProperty("risk_factors")          List<String> riskFactors,
        @JsonProperty("potential_penalties")   List<String> potentialPenalties,
        @JsonProperty("business_impact")       String businessImpact,
        @JsonProperty("risk_summary")          String riskSummary,
        @JsonProperty("narrative_source")      RecordSource narrativeSource
) {
    public MergedRiskAssessment {
        severityDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(severityDistribution));
        riskFactors = List.copyOf(riskFactors);
        potentialPenalties = List.copyOf(potentialPenalties);
    }
}
