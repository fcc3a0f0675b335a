package com.eainde.compliance.mapper;

import com.eainde.compliance.citation.RegulationCitationTable;
import com.eainde.compliance.document.DocumentNode;
import com.eainde.compliance.document.DocumentTree;
import com.eainde.compliance.document.ElementLocator;
import com.eainde.compliance.document.RequestContext;
import com.eainde.compliance.model.ComplianceReport;
import com.eainde.compliance.model.MappedIssue;
import com.eainde.compliance.model.PriorityMatrix;
import com.eainde.compliance.model.RecordSource;
import com.eainde.compliance.model.Severity;
import com.eainde.compliance.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves violations to elements, attaches citations and fix priorities, and aggregates the
 * compliance report.
 *
 * <h3>Guarantees</h3>
 * <ul>
 *   <li>Exactly one mapped issue per violation.</li>
 *   <li>Output is stably sorted by fix priority, so violations of equal priority keep scan order.</li>
 *   <li>{@code severity_breakdown} always lists all four severities and sums to {@code total_issues}.</li>
 * </ul>
 */
public class IssueMapper {

    private static final Logger log = LoggerFactory.getLogger(IssueMapper.class);

    static final Map<Severity, String> BUSINESS_IMPACT = Map.of(
            Severity.CRITICAL, "Legal liability, potential lawsuits, immediate compliance action required",
            Severity.HIGH, "Significant user accessibility barriers, compliance violations",
            Severity.MEDIUM, "User experience issues, potential compliance gaps",
            Severity.LOW, "Minor usability issues, best practice improvements");

    private final RegulationCitationTable citations;
    private final ScoringPolicy policy;
    private final ElementResolver resolver = new ElementResolver();

    public IssueMapper(RegulationCitationTable citations, ScoringPolicy policy) {
        this.citations = citations;
        this.policy = policy;
    }

    /**
     * @param context the request the document was scanned under; host-dependent kinds are
     *                located with the same host the scanner used
     */
    public MappingResult map(DocumentNode document, RequestContext context, List<Violation> violations) {
        DocumentTree tree = DocumentTree.of(document);
        PriorityAssigner priorities = new PriorityAssigner(policy);

        List<MappedIssue> mapped = new ArrayList<>(violations.size());
        for (Violation violation : violations) {
            ElementLocator locator = resolver.resolve(tree, context, violation.kind());
            mapped.add(toIssue(violation, locator, priorities.next(violation.severity()), RecordSource.TECHNICAL));
        }
        mapped.sort(Comparator.comparingInt(MappedIssue::fixPriority));

        ComplianceReport report = report(mapped);
        log.debug("Mapped {} violations, score {}", mapped.size(), report.complianceScore());
        return new MappingResult(mapped, report, PriorityMatrix.of(mapped));
    }

    /**
     * Maps a finding that did not come from the scanner. The caller supplies the locator and
     * an assigner seeded with the issues already mapped.
     */
    public MappedIssue mapFinding(Violation finding, RecordSource source, ElementLocator locator,
                                  PriorityAssigner priorities) {
        return toIssue(finding, locator, priorities.next(finding.severity()), source);
    }

    public ComplianceReport report(List<MappedIssue> issues) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        Map<String, Integer> severityBreakdown = ComplianceReport.emptySeverityBreakdown();
        Map<String, Integer> categoryBreakdown = new LinkedHashMap<>();
        for (MappedIssue issue : issues) {
            counts.merge(issue.severity(), 1, Integer::sum);
            severityBreakdown.merge(issue.severity().label(), 1, Integer::sum);
            categoryBreakdown.merge(citations.family(issue.kind()), 1, Integer::sum);
        }
        return new ComplianceReport(issues.size(), severityBreakdown, categoryBreakdown, policy.score(counts));
    }

    public ScoringPolicy policy() {
        return policy;
    }

    private MappedIssue toIssue(Violation v, ElementLocator locator, int priority, RecordSource source) {
        String regulation = v.regulation() != null && !v.regulation().isBlank()
                ? v.regulation()
                : citations.primaryCitation(v.kind());
        return new MappedIssue(
                v.kind(),
                v.severity(),
                v.subject(),
                v.description(),
                regulation,
                v.suggestion(),
                locator.path(),
                locator.selector(),
                BUSINESS_IMPACT.get(v.severity()),
                priority,
                citations.estimatedEffort(v.kind()),
                citations.citationsFor(v.kind()),
                source);
    }
}
