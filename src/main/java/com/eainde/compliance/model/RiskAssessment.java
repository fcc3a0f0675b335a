package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Qualitative risk view produced by the risk-assessment role.
 *
 * @param overallRiskLevel one of critical, high, medium, low
 */
public record RiskAssessment(
        @JsonProperty("overall_risk_level")  String overallRiskLevel,
        @JsonProperty("risk_factors")        List<String> riskFactors,
        @JsonProperty("potential_penalties") List<String> potentialPenalties,
        @JsonProperty("business_impact")     String businessImpact,
        @JsonProperty("risk_summary")        String riskSummary,
        @JsonProperty("source")              RecordSource source
) implements NarrativeRecord {

    public RiskAssessment {
        riskFactors = List.copyOf(riskFactors);
        potentialPenalties = List.copyOf(potentialPenalties);
    }

    @Override
    public NarratorRole role() {
        return NarratorRole.RISK_ASSESSMENT;
    }

    @Override
    public String summary() {
        return riskSummary;
    }

    @Override
    public String digest() {
        StringBuilder sb = new StringBuilder("Overall risk: ").append(overallRiskLevel).append(". ").append(riskSummary);
        riskFactors.stream().limit(3).forEach(f -> sb.append("\n- factor: ").append(f));
        potentialPenalties.stream().limit(2).forEach(p -> sb.append("\n- penalty: ").append(p));
        return sb.toString();
    }
}
