package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Final audit output.
 *
 * <p>On {@link AuditStatus#FAILED} only {@code status}, {@code failedStage} and
 * {@code warnings} are set; every other field is null and omitted from JSON.
 *
 * <p>{@code complianceScore}, {@code totalIssues} and the breakdowns always describe the
 * technical scan; narrative findings appear in {@code mappedIssues} and the narrative section.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CombinedReport(
        @JsonProperty("status")             AuditStatus status,
        @JsonProperty("failed_stage")       PipelineStage failedStage,
        @JsonProperty("compliance_score")   Integer complianceScore,
        @JsonProperty("total_issues")       Integer totalIssues,
        @JsonProperty("severity_breakdown") Map<String, Integer> severityBreakdown,
        @JsonProperty("category_breakdown") Map<String, Integer> categoryBreakdown,
        @JsonProperty("mapped_issues")      List<MappedIssue> mappedIssues,
        @JsonProperty("priority_matrix")    PriorityMatrix priorityMatrix,
        @JsonProperty("remediation_plan")   RemediationPlan remediationPlan,
        @JsonProperty("narrative")          NarrativeSection narrative,
        @JsonProperty("succeeded_roles")    List<NarratorRole> succeededRoles,
        @JsonProperty("warnings")           List<String> warnings
) {

    public static CombinedReport failed(PipelineStage stage, String message) {
        return new CombinedReport(AuditStatus.FAILED, stage, null, null, null, null,
                null, null, null, null, null, List.of(message));
    }
}
