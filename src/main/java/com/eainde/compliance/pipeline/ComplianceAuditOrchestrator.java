package com.eainde.compliance.pipeline;

import com.eainde.compliance.document.DocumentNode;
import com.eainde.compliance.document.DocumentTree;
import com.eainde.compliance.document.ElementLocator;
import com.eainde.compliance.document.RequestContext;
import com.eainde.compliance.mapper.IssueMapper;
import com.eainde.compliance.mapper.MappingResult;
import com.eainde.compliance.model.AuditStatus;
import com.eainde.compliance.model.CombinedReport;
import com.eainde.compliance.model.ImplementationRoadmap;
import com.eainde.compliance.model.LegalContext;
import com.eainde.compliance.model.MappedIssue;
import com.eainde.compliance.model.NarrativeRecord;
import com.eainde.compliance.model.NarrativeSection;
import com.eainde.compliance.model.NarratorRole;
import com.eainde.compliance.model.PipelineStage;
import com.eainde.compliance.model.PriorityMatrix;
import com.eainde.compliance.model.RemediationPlan;
import com.eainde.compliance.model.RiskAssessment;
import com.eainde.compliance.model.ScanEnhancement;
import com.eainde.compliance.narrative.Narrator;
import com.eainde.compliance.narrative.NarrativeDefaults;
import com.eainde.compliance.narrative.NarrativeInsightExtractor;
import com.eainde.compliance.remediation.RemediationAdvisor;
import com.eainde.compliance.scanner.ScanResult;
import com.eainde.compliance.scanner.TechnicalScanner;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one audit end to end.
 *
 * <h3>Flow</h3>
 * <pre>
 * STEP 1  SCAN -> MAP -> PLAN        synchronous; any failure is a PipelineException naming the stage
 * STEP 2  scan_enhance -> legal_context -> risk_assessment -> roadmap
 *         each role sees the technical summary plus every earlier successful role's digest;
 *         a failed, null or slow role is a warning, never fatal
 * STEP 3  merge technical and narrative results
 * </pre>
 *
 * <p>Narrator calls run one at a time on {@code narratorExecutor} with a per-role timeout;
 * a timed-out call is cancelled and the run moves on. Interruption of the calling thread
 * aborts the run with {@link AuditCancelledException}.</p>
 *
 * <p>No state is kept between runs; concurrent audits on one instance are independent.</p>
 */
@Log4j2
public class ComplianceAuditOrchestrator {

    static final List<NarratorRole> ROLE_ORDER = List.of(
            NarratorRole.SCAN_ENHANCE,
            NarratorRole.LEGAL_CONTEXT,
            NarratorRole.RISK_ASSESSMENT,
            NarratorRole.ROADMAP);

    private final TechnicalScanner scanner;
    private final IssueMapper issueMapper;
    private final RemediationAdvisor advisor;
    private final NarrativeInsightExtractor extractor;
    private final ReportMerger merger;
    private final Executor narratorExecutor;
    private final Duration roleTimeout;

    public ComplianceAuditOrchestrator(TechnicalScanner scanner,
                                       IssueMapper issueMapper,
                                       RemediationAdvisor advisor,
                                       NarrativeInsightExtractor extractor,
                                       ReportMerger merger,
                                       Executor narratorExecutor,
                                       Duration roleTimeout) {
        if (roleTimeout == null || roleTimeout.isNegative() || roleTimeout.isZero()) {
            throw new IllegalArgumentException("roleTimeout must be positive, got " + roleTimeout);
        }
        this.scanner = scanner;
        this.issueMapper = issueMapper;
        this.advisor = advisor;
        this.extractor = extractor;
        this.merger = merger;
        this.narratorExecutor = narratorExecutor;
        this.roleTimeout = roleTimeout;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @throws PipelineException       when a technical stage fails
     * @throws AuditCancelledException when the calling thread is interrupted during the role loop
     */
    public CombinedReport runAudit(DocumentNode document, RequestContext context, Narrator narrator) {

        // ── STEP 1: Technical stages ────────────────────────────────────
        ScanResult scan = stage(PipelineStage.SCAN, () -> scanner.scanWithWarnings(document, context));
        MappingResult mapping = stage(PipelineStage.MAP, () -> issueMapper.map(document, context, scan.violations()));
        RemediationPlan plan = stage(PipelineStage.PLAN, () -> advisor.plan(mapping.mappedIssues()));
        log.info("Technical stages complete — {} violations, score {}, {} fixes",
                scan.violations().size(), mapping.report().complianceScore(), plan.fixes().size());

        List<String> warnings = new ArrayList<>(scan.warnings());

        // ── STEP 2: Narrative roles ─────────────────────────────────────
        AuditContext auditContext = AuditContext.initial(
                TechnicalSummary.describe(context, scan.violations(), mapping, plan));
        Map<NarratorRole, NarrativeRecord> records = new EnumMap<>(NarratorRole.class);
        List<NarratorRole> succeeded = new ArrayList<>();

        for (NarratorRole role : ROLE_ORDER) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AuditCancelledException("Audit cancelled before role " + role, null);
            }
            Optional<String> text = ask(narrator, role, auditContext.render(), warnings);
            if (text.isEmpty()) continue;

            NarrativeRecord record = extractor.extract(role, text.get());
            records.put(role, record);
            succeeded.add(role);
            auditContext = auditContext.with(record);
            log.info("Role {} complete — source {}", role, record.source());
        }

        // ── STEP 3: Merge ───────────────────────────────────────────────
        ScanEnhancement enhancement = (ScanEnhancement) recordFor(records, NarratorRole.SCAN_ENHANCE);
        LegalContext legal = (LegalContext) recordFor(records, NarratorRole.LEGAL_CONTEXT);
        RiskAssessment risk = (RiskAssessment) recordFor(records, NarratorRole.RISK_ASSESSMENT);
        ImplementationRoadmap roadmap = (ImplementationRoadmap) recordFor(records, NarratorRole.ROADMAP);

        List<MappedIssue> issues = merger.mergeIssues(mapping.mappedIssues(), enhancement, findingLocator(document));
        NarrativeSection narrative = new NarrativeSection(
                enhancement,
                legal,
                merger.mergeRisk(mapping.report(), risk),
                merger.mergeRoadmap(plan, roadmap));

        AuditStatus status = succeeded.size() == ROLE_ORDER.size() ? AuditStatus.COMPLETED : AuditStatus.PARTIAL;
        log.info("Audit {} — {}/{} roles succeeded, {} mapped issues, {} warnings",
                status.label(), succeeded.size(), ROLE_ORDER.size(), issues.size(), warnings.size());

        return new CombinedReport(
                status,
                null,
                mapping.report().complianceScore(),
                mapping.report().totalIssues(),
                mapping.report().severityBreakdown(),
                mapping.report().categoryBreakdown(),
                issues,
                PriorityMatrix.of(issues),
                plan,
                narrative,
                List.copyOf(succeeded),
                List.copyOf(warnings));
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    private static <T> T stage(PipelineStage stage, Supplier<T> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.error("{} stage failed", stage, e);
            throw new PipelineException(stage, e);
        }
    }

    /**
     * Calls one role with the timeout. Empty when the role failed, timed out or returned null;
     * the reason is appended to {@code warnings}.
     */
    private Optional<String> ask(Narrator narrator, NarratorRole role, String context, List<String> warnings) {
        FutureTask<String> task = new FutureTask<>(() -> narrator.ask(role, context));
        try {
            narratorExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            return failed(role, "executor rejected the call", warnings);
        }

        try {
            String text = task.get(roleTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (text == null) {
                return failed(role, "narrator returned no text", warnings);
            }
            return Optional.of(text);
        } catch (TimeoutException e) {
            task.cancel(true);
            return failed(role, "timed out after " + roleTimeout.toMillis() + " ms", warnings);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failed(role, cause.getClass().getSimpleName() + ": " + cause.getMessage(), warnings);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new AuditCancelledException("Audit cancelled during role " + role, e);
        }
    }

    private static Optional<String> failed(NarratorRole role, String reason, List<String> warnings) {
        log.warn("Role {} skipped — {}", role, reason);
        warnings.add("Role " + role + " skipped: " + reason);
        return Optional.empty();
    }

    private static NarrativeRecord recordFor(Map<NarratorRole, NarrativeRecord> records, NarratorRole role) {
        NarrativeRecord record = records.get(role);
        return record != null ? record : NarrativeDefaults.forRole(role);
    }

    /** Narrative findings have no element of their own; they are located at {@code body}. */
    private static ElementLocator findingLocator(DocumentNode document) {
        DocumentTree tree = DocumentTree.of(document);
        return tree.first(n -> n.is("body"))
                .map(ElementLocator::of)
                .orElseGet(() -> ElementLocator.documentRoot(tree));
    }
}
