package com.eainde.compliance.pipeline;

import com.eainde.compliance.TestPages;
import com.eainde.compliance.citation.RegulationCitationTable;
import com.eainde.compliance.document.DocumentNode;
import com.eainde.compliance.document.RequestContext;
import com.eainde.compliance.mapper.IssueMapper;
import com.eainde.compliance.mapper.ScoringPolicy;
import com.eainde.compliance.model.AuditStatus;
import com.eainde.compliance.model.CombinedReport;
import com.eainde.compliance.model.MappedIssue;
import com.eainde.compliance.model.NarratorRole;
import com.eainde.compliance.model.PipelineStage;
import com.eainde.compliance.model.RecordSource;
import com.eainde.compliance.model.RoadmapEntry;
import com.eainde.compliance.narrative.NarrativeInsightExtractor;
import com.eainde.compliance.narrative.Narrator;
import com.eainde.compliance.remediation.RemediationAdvisor;
import com.eainde.compliance.scanner.RuleRegistry;
import com.eainde.compliance.scanner.TechnicalScanner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ComplianceAuditOrchestratorTest {

    private static final RegulationCitationTable CITATIONS = RegulationCitationTable.loadDefault(new ObjectMapper());

    private static final String SCAN_JSON = """
            {"findings": [
               {"kind": "security.no_encryption", "severity": "critical", "subject": "protocol", "description": "dup"},
               {"kind": "wcag.color_contrast", "severity": "medium", "subject": "body text", "description": "Low contrast"}],
             "summary": "Contrast issue found."}""";
    private static final String LEGAL_JSON = """
            {"relevant_regulations": ["GDPR Article 32"], "update_summary": "Security of processing applies."}""";
    private static final String RISK_JSON = """
            {"overall_risk_level": "high", "risk_factors": ["Unencrypted transport"], "risk_summary": "Risk is high."}""";
    private static final String ROADMAP_JSON = """
            {"immediate": ["Install a TLS certificate"], "short_term": [], "long_term": [],
             "ongoing_maintenance": ["Review contrast quarterly"]}""";

    private final TechnicalScanner scanner = new TechnicalScanner(RuleRegistry.standard(), CITATIONS);
    private final IssueMapper issueMapper = new IssueMapper(CITATIONS, ScoringPolicy.defaults());
    private final RemediationAdvisor advisor = new RemediationAdvisor(ScoringPolicy.defaults());
    private final NarrativeInsightExtractor extractor = new NarrativeInsightExtractor(new ObjectMapper());

    private final DocumentNode page = TestPages.page(TestPages.imageWithoutAlt("/img/boot.jpg"));
    private final RequestContext context = TestPages.http();

    private MdcAwareExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new MdcAwareExecutor("narrator-test");
    }

    @AfterEach
    void tearDown() {
        executor.close();
        MDC.clear();
    }

    private ComplianceAuditOrchestrator orchestrator(Duration timeout) {
        return orchestrator(scanner, issueMapper, advisor, timeout);
    }

    private ComplianceAuditOrchestrator orchestrator(TechnicalScanner scanner, IssueMapper mapper,
                                                     RemediationAdvisor advisor, Duration timeout) {
        return new ComplianceAuditOrchestrator(scanner, mapper, advisor, extractor,
                new ReportMerger(mapper), executor, timeout);
    }

    private static String scripted(NarratorRole role) {
        return switch (role) {
            case SCAN_ENHANCE -> SCAN_JSON;
            case LEGAL_CONTEXT -> LEGAL_JSON;
            case RISK_ASSESSMENT -> RISK_JSON;
            case ROADMAP -> ROADMAP_JSON;
        };
    }

    /** Blocks until cancelled. */
    private static String block() {
        try {
            new CountDownLatch(1).await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "too late";
    }

    // =========================================================================
    //  Completed runs
    // =========================================================================

    @Nested
    @DisplayName("All roles succeed")
    class Completed {

        private final Map<NarratorRole, String> contexts = new ConcurrentHashMap<>();
        private final Narrator narrator = (role, ctx) -> {
            contexts.put(role, ctx);
            return scripted(role);
        };

        @Test
        @DisplayName("status is completed with every role listed in order")
        void status() {
            CombinedReport report = orchestrator(Duration.ofSeconds(5)).runAudit(page, context, narrator);

            assertThat(report.status()).isEqualTo(AuditStatus.COMPLETED);
            assertThat(report.failedStage()).isNull();
            assertThat(report.succeededRoles()).containsExactly(NarratorRole.values());
            assertThat(report.warnings()).isEmpty();
        }

        @Test
        @DisplayName("score and totals stay technical while narrative findings join the issue list")
        void technicalScore() {
            CombinedReport report = orchestrator(Duration.ofSeconds(5)).runAudit(page, context, narrator);

            assertThat(report.complianceScore()).isEqualTo(50);
            assertThat(report.totalIssues()).isEqualTo(2);
            assertThat(report.mappedIssues())
                    .extracting(MappedIssue::kind)
                    .containsExactly("security.no_encryption", "wcag.missing_alt", "wcag.color_contrast");
            MappedIssue contrast = report.mappedIssues().get(2);
            assertThat(contrast.source()).isEqualTo(RecordSource.NARRATIVE_STRICT);
            assertThat(contrast.fixPriority()).isEqualTo(5);
            assertThat(contrast.elementPath()).containsExactly("html[1]", "body[1]");
            assertThat(report.priorityMatrix().mediumPriority()).containsExactly(contrast);
        }

        @Test
        @DisplayName("each role sees the technical summary plus every earlier role")
        void contextAccumulates() {
            orchestrator(Duration.ofSeconds(5)).runAudit(page, context, narrator);

            assertThat(contexts.get(NarratorRole.SCAN_ENHANCE))
                    .startsWith("TECHNICAL COMPLIANCE ANALYSIS RESULTS:")
                    .contains("Website: " + TestPages.HTTP_URL)
                    .doesNotContain("FINDINGS:\n");
            assertThat(contexts.get(NarratorRole.LEGAL_CONTEXT))
                    .contains("SCAN_ENHANCE FINDINGS:\nContrast issue found.")
                    .doesNotContain("LEGAL_CONTEXT FINDINGS:");
            assertThat(contexts.get(NarratorRole.ROADMAP))
                    .containsSubsequence("SCAN_ENHANCE FINDINGS:", "LEGAL_CONTEXT FINDINGS:", "RISK_ASSESSMENT FINDINGS:");
        }

        @Test
        @DisplayName("risk and roadmap merge technical and narrative parts")
        void narrativeSection() {
            CombinedReport report = orchestrator(Duration.ofSeconds(5)).runAudit(page, context, narrator);

            assertThat(report.narrative().riskAssessment().overallRiskLevel()).isEqualTo("critical");
            assertThat(report.narrative().riskAssessment().narrativeRiskLevel()).isEqualTo("high");
            assertThat(report.narrative().riskAssessment().riskSummary()).endsWith("Risk is high.");
            assertThat(report.narrative().roadmap().criticalImmediate())
                    .extracting(RoadmapEntry::action)
                    .containsExactly("HTTPS Security", "Install a TLS certificate");
            assertThat(report.narrative().roadmap().ongoingMaintenance())
                    .extracting(RoadmapEntry::action)
                    .containsExactly("Review contrast quarterly");
            assertThat(report.narrative().legalContext().relevantRegulations()).containsExactly("GDPR Article 32");
        }

        @Test
        @DisplayName("the caller's MDC reaches the narrator thread")
        void mdcPropagates() {
            Map<NarratorRole, String> auditIds = new ConcurrentHashMap<>();
            MDC.put("auditId", "audit-42");

            orchestrator(Duration.ofSeconds(5)).runAudit(page, context, (role, ctx) -> {
                auditIds.put(role, String.valueOf(MDC.get("auditId")));
                return scripted(role);
            });

            assertThat(auditIds).hasSize(4).containsValue("audit-42").doesNotContainValue("null");
        }
    }

    // =========================================================================
    //  Partial runs
    // =========================================================================

    @Nested
    @DisplayName("Degraded roles")
    class Partial {

        @Test
        @DisplayName("a failing role is skipped with a warning and left out of later contexts")
        void failingRole() {
            Map<NarratorRole, String> contexts = new ConcurrentHashMap<>();
            Narrator narrator = (role, ctx) -> {
                contexts.put(role, ctx);
                if (role == NarratorRole.LEGAL_CONTEXT) throw new IllegalStateException("quota exceeded");
                return scripted(role);
            };

            CombinedReport report = orchestrator(Duration.ofSeconds(5)).runAudit(page, context, narrator);

            assertThat(report.status()).isEqualTo(AuditStatus.PARTIAL);
            assertThat(report.succeededRoles()).containsExactly(
                    NarratorRole.SCAN_ENHANCE, NarratorRole.RISK_ASSESSMENT, NarratorRole.ROADMAP);
            assertThat(report.warnings()).singleElement().asString()
                    .contains("legal_context").contains("quota exceeded");
            assertThat(contexts.get(NarratorRole.ROADMAP)).doesNotContain("LEGAL_CONTEXT FINDINGS:");
            assertThat(report.narrative().legalContext().source()).isEqualTo(RecordSource.NARRATIVE_DEFAULT);
        }

        @Test
        @DisplayName("a null answer counts as a failed role")
        void nullAnswer() {
            Narrator narrator = (role, ctx) -> role == NarratorRole.ROADMAP ? null : scripted(role);

            CombinedReport report = orchestrator(Duration.ofSeconds(5)).runAudit(page, context, narrator);

            assertThat(report.status()).isEqualTo(AuditStatus.PARTIAL);
            assertThat(report.succeededRoles()).doesNotContain(NarratorRole.ROADMAP);
            assertThat(report.warnings()).anyMatch(w -> w.contains("no text"));
        }

        @Test
        @DisplayName("when every role times out the technical issues are returned unchanged")
        void allTimeOut() {
            List<MappedIssue> technical = issueMapper.map(page, context, scanner.scan(page, context)).mappedIssues();

            CombinedReport report = orchestrator(Duration.ofMillis(50))
                    .runAudit(page, context, (role, ctx) -> block());

            assertThat(report.status()).isEqualTo(AuditStatus.PARTIAL);
            assertThat(report.succeededRoles()).isEmpty();
            assertThat(report.mappedIssues()).isEqualTo(technical);
            assertThat(report.warnings()).hasSize(4).allMatch(w -> w.contains("timed out"));
            assertThat(report.narrative().riskAssessment().overallRiskLevel()).isEqualTo("critical");
            assertThat(report.narrative().roadmap().criticalImmediate()).extracting(RoadmapEntry::issueKind)
                    .containsExactly("security.no_encryption");
        }
    }

    // =========================================================================
    //  Failures and cancellation
    // =========================================================================

    @Nested
    @DisplayName("Failures and cancellation")
    class Failures {

        @Test
        @DisplayName("scan failure raises a PipelineException naming the scan stage")
        void scanFailure() {
            assertThatThrownBy(() -> orchestrator(Duration.ofSeconds(1)).runAudit(null, context, (r, c) -> "x"))
                    .isInstanceOfSatisfying(PipelineException.class,
                            e -> assertThat(e.getStage()).isEqualTo(PipelineStage.SCAN));
        }

        @Test
        @DisplayName("a document nested past the depth limit fails the scan stage instead of overflowing")
        void deepDocument() {
            assertThatThrownBy(() -> orchestrator(Duration.ofSeconds(1))
                    .runAudit(TestPages.nestedDivs(50_000), context, (r, c) -> "x"))
                    .isInstanceOfSatisfying(PipelineException.class,
                            e -> assertThat(e.getStage()).isEqualTo(PipelineStage.SCAN))
                    .hasMessageContaining("nested deeper than");
        }

        @Test
        @DisplayName("map and plan failures name their stage")
        void laterStages() {
            IssueMapper brokenMapper = mock(IssueMapper.class);
            when(brokenMapper.map(any(), any(), any())).thenThrow(new IllegalStateException("mapper down"));
            RemediationAdvisor brokenAdvisor = mock(RemediationAdvisor.class);
            when(brokenAdvisor.plan(any())).thenThrow(new IllegalStateException("advisor down"));

            assertThatThrownBy(() -> orchestrator(scanner, brokenMapper, advisor, Duration.ofSeconds(1))
                    .runAudit(page, context, (r, c) -> "x"))
                    .isInstanceOfSatisfying(PipelineException.class,
                            e -> assertThat(e.getStage()).isEqualTo(PipelineStage.MAP))
                    .hasMessageContaining("mapper down");
            assertThatThrownBy(() -> orchestrator(scanner, issueMapper, brokenAdvisor, Duration.ofSeconds(1))
                    .runAudit(page, context, (r, c) -> "x"))
                    .isInstanceOfSatisfying(PipelineException.class,
                            e -> assertThat(e.getStage()).isEqualTo(PipelineStage.PLAN));
        }

        @Test
        @DisplayName("an interrupted caller aborts before the next role")
        void interruptedBeforeRoles() {
            Thread.currentThread().interrupt();
            try {
                assertThatThrownBy(() -> orchestrator(Duration.ofSeconds(1)).runAudit(page, context, (r, c) -> "x"))
                        .isInstanceOf(AuditCancelledException.class);
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        @DisplayName("interrupt during a role call cancels the run and restores the flag")
        void interruptedDuringRole() {
            Thread caller = Thread.currentThread();
            Narrator narrator = (role, ctx) -> {
                caller.interrupt();
                return block();
            };

            try {
                assertThatThrownBy(() -> orchestrator(Duration.ofSeconds(5)).runAudit(page, context, narrator))
                        .isInstanceOf(AuditCancelledException.class)
                        .hasCauseInstanceOf(InterruptedException.class);
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        @DisplayName("non-positive timeout is rejected")
        void invalidTimeout() {
            assertThatThrownBy(() -> orchestrator(Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
