package com.eainde.compliance.pipeline;

import com.eainde.compliance.document.ElementLocator;
import com.eainde.compliance.mapper.IssueMapper;
import com.eainde.compliance.mapper.PriorityAssigner;
import com.eainde.compliance.model.ComplianceReport;
import com.eainde.compliance.model.ImplementationRoadmap;
import com.eainde.compliance.model.MappedIssue;
import com.eainde.compliance.model.MergedRiskAssessment;
import com.eainde.compliance.model.MergedRoadmap;
import com.eainde.compliance.model.RecordSource;
import com.eainde.compliance.model.RemediationFix;
import com.eainde.compliance.model.RemediationPlan;
import com.eainde.compliance.model.RiskAssessment;
import com.eainde.compliance.model.RoadmapAction;
import com.eainde.compliance.model.RoadmapEntry;
import com.eainde.compliance.model.ScanEnhancement;
import com.eainde.compliance.model.Severity;
import com.eainde.compliance.model.Violation;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges technical results with narrative records. No LLM call.
 *
 * <h3>Merge rules</h3>
 * <pre>
 * issues   technical + narrative findings, dedup by (kind, subject), technical wins
 * risk     level from technical severity counts; narrative factors and penalties appended
 * roadmap  technical phase entries first, then narrative actions:
 *            immediate  -> critical_immediate
 *            short_term -> high_priority
 *            long_term  -> medium_priority
 *            ongoing    -> ongoing_maintenance
 * </pre>
 *
 * <p>Merging the same narrative findings twice adds nothing the second time.</p>
 */
@Log4j2
public class ReportMerger {

    private final IssueMapper issueMapper;

    public ReportMerger(IssueMapper issueMapper) {
        this.issueMapper = issueMapper;
    }

    // =========================================================================
    //  Issues
    // =========================================================================

    public List<MappedIssue> mergeIssues(List<MappedIssue> issues, ScanEnhancement enhancement,
                                         ElementLocator findingLocator) {
        Set<MappedIssue.IssueKey> seen = new HashSet<>();
        issues.forEach(i -> seen.add(i.key()));

        PriorityAssigner priorities = PriorityAssigner.continuing(issueMapper.policy(), issues);
        List<MappedIssue> merged = new ArrayList<>(issues);
        int added = 0;
        for (Violation finding : enhancement.findings()) {
            if (!seen.add(new MappedIssue.IssueKey(finding.kind(), finding.subject()))) continue;
            merged.add(issueMapper.mapFinding(finding, enhancement.source(), findingLocator, priorities));
            added++;
        }
        if (added == 0) return issues;

        merged.sort(Comparator.comparingInt(MappedIssue::fixPriority));
        log.info("Issue merge — {} narrative findings added, {} duplicates dropped",
                added, enhancement.findings().size() - added);
        return List.copyOf(merged);
    }

    // =========================================================================
    //  Risk
    // =========================================================================

    public MergedRiskAssessment mergeRisk(ComplianceReport report, RiskAssessment narrative) {
        String level = technicalRiskLevel(report);
        String summary = "Technical scan found " + report.totalIssues() + " issues (score "
                + report.complianceScore() + "/100), overall risk " + level + ".";
        if (narrative.source() != RecordSource.NARRATIVE_DEFAULT) {
            summary = summary + " " + narrative.riskSummary();
        }
        return new MergedRiskAssessment(
                level,
                narrative.overallRiskLevel(),
                report.severityBreakdown(),
                report.complianceScore(),
                narrative.riskFactors(),
                narrative.potentialPenalties(),
                narrative.businessImpact(),
                summary,
                narrative.source());
    }

    /** Highest severity present, or {@code low} for a clean scan. */
    static String technicalRiskLevel(ComplianceReport report) {
        for (Severity severity : Severity.values()) {
            if (report.count(severity) > 0) return severity.label();
        }
        return Severity.LOW.label();
    }

    // =========================================================================
    //  Roadmap
    // =========================================================================

    public MergedRoadmap mergeRoadmap(RemediationPlan plan, ImplementationRoadmap narrative) {
        Map<String, RemediationFix> fixes = new LinkedHashMap<>();
        plan.fixes().forEach(f -> fixes.put(f.issueKind(), f));

        List<RoadmapEntry> critical = technicalEntries(plan.phases().criticalImmediate(), fixes);
        List<RoadmapEntry> high = technicalEntries(plan.phases().highPriority(), fixes);
        List<RoadmapEntry> medium = technicalEntries(plan.phases().mediumPriority(), fixes);
        List<RoadmapEntry> ongoing = new ArrayList<>();

        appendNarrative(critical, narrative.immediate(), narrative.source());
        appendNarrative(high, narrative.shortTerm(), narrative.source());
        appendNarrative(medium, narrative.longTerm(), narrative.source());
        appendNarrative(ongoing, narrative.ongoingMaintenance(), narrative.source());

        String summary = plan.fixes().size() + " technical fixes (" + plan.estimatedTotalTime() + ") and "
                + narrative.actionCount() + " narrative actions.";
        if (narrative.source() != RecordSource.NARRATIVE_DEFAULT) {
            summary = summary + " " + narrative.roadmapSummary();
        }
        return new MergedRoadmap(critical, high, medium, ongoing, summary);
    }

    private static List<RoadmapEntry> technicalEntries(List<String> kinds, Map<String, RemediationFix> fixes) {
        List<RoadmapEntry> entries = new ArrayList<>();
        for (String kind : kinds) {
            RemediationFix fix = fixes.get(kind);
            if (fix != null) entries.add(RoadmapEntry.fromFix(fix, fix.description()));
        }
        return entries;
    }

    private static void appendNarrative(List<RoadmapEntry> target, List<RoadmapAction> actions, RecordSource source) {
        for (RoadmapAction action : actions) {
            target.add(RoadmapEntry.fromAction(action, source));
        }
    }
}
