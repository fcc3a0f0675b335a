package com.eainde.compliance.service;

import com.eainde.compliance.TestPages;
import com.eainde.compliance.document.DocumentNode;
import com.eainde.compliance.document.DocumentTree;
import com.eainde.compliance.document.HtmlDocumentParser;
import com.eainde.compliance.document.RequestContext;
import com.eainde.compliance.model.AuditStatus;
import com.eainde.compliance.model.CombinedReport;
import com.eainde.compliance.model.PipelineStage;
import com.eainde.compliance.narrative.Narrator;
import com.eainde.compliance.pipeline.ComplianceAuditOrchestrator;
import com.eainde.compliance.pipeline.PipelineException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComplianceAuditServiceTest {

    @Mock
    private ComplianceAuditOrchestrator orchestrator;

    @Mock
    private Narrator narrator;

    private ComplianceAuditService service;

    @BeforeEach
    void setUp() {
        service = new ComplianceAuditService(new HtmlDocumentParser(), orchestrator, narrator);
    }

    @Test
    @DisplayName("parses the html and runs the orchestrator under a fresh auditId")
    void runsAudit() {
        CombinedReport expected = CombinedReport.failed(PipelineStage.SCAN, "placeholder");
        AtomicReference<String> auditId = new AtomicReference<>();
        when(orchestrator.runAudit(any(), any(), eq(narrator))).thenAnswer(inv -> {
            auditId.set(MDC.get(ComplianceAuditService.AUDIT_ID));
            return expected;
        });

        CombinedReport report = service.audit("https://shop.example.com", "<html><body><h1>Hi</h1></body></html>");

        ArgumentCaptor<DocumentNode> document = ArgumentCaptor.forClass(DocumentNode.class);
        ArgumentCaptor<RequestContext> context = ArgumentCaptor.forClass(RequestContext.class);
        verify(orchestrator).runAudit(document.capture(), context.capture(), eq(narrator));
        assertThat(report).isSameAs(expected);
        assertThat(DocumentTree.of(document.getValue()).byTag("h1")).hasSize(1);
        assertThat(context.getValue().isHttps()).isTrue();
        assertThat(auditId.get()).isNotBlank();
        assertThat(MDC.get(ComplianceAuditService.AUDIT_ID)).isNull();
    }

    @Test
    @DisplayName("a stage failure becomes a failed report")
    void stageFailure() {
        when(orchestrator.runAudit(any(), any(), any()))
                .thenThrow(new PipelineException(PipelineStage.MAP, new IllegalStateException("bad citation")));

        CombinedReport report = service.audit("http://shop.example.com", "<p>x</p>");

        assertThat(report.status()).isEqualTo(AuditStatus.FAILED);
        assertThat(report.failedStage()).isEqualTo(PipelineStage.MAP);
        assertThat(report.warnings()).containsExactly("map stage failed: bad citation");
        assertThat(report.mappedIssues()).isNull();
        assertThat(MDC.get(ComplianceAuditService.AUDIT_ID)).isNull();
    }

    @Test
    @DisplayName("blank url or html is rejected before any work")
    void invalidInput() {
        assertThatThrownBy(() -> service.audit("", "<p>x</p>")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.audit("https://shop.example.com", " "))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("pages nested past the depth limit are rejected as invalid input")
    void deepPage() {
        assertThatThrownBy(() -> service.audit("https://shop.example.com", TestPages.nestedDivHtml(50_000)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("failed reports carry only status, stage and warnings")
    void failedShape() {
        CombinedReport failed = CombinedReport.failed(PipelineStage.PLAN, "boom");

        assertThat(failed.complianceScore()).isNull();
        assertThat(failed.succeededRoles()).isNull();
        assertThat(failed.warnings()).isEqualTo(List.of("boom"));
    }
}
