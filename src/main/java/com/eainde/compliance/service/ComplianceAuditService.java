package com.eainde.compliance.service;

import com.eainde.compliance.document.DocumentNode;
import com.eainde.compliance.document.HtmlDocumentParser;
import com.eainde.compliance.document.RequestContext;
import com.eainde.compliance.model.CombinedReport;
import com.eainde.compliance.narrative.Narrator;
import com.eainde.compliance.pipeline.ComplianceAuditOrchestrator;
import com.eainde.compliance.pipeline.PipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Entry point for one audit: parses the page, tags the run with an {@code auditId} in the MDC
 * and turns a technical-stage failure into a {@code failed} report.
 */
@Log4j2
@Service
@RequiredArgsConstructor
public class ComplianceAuditService {

    static final String AUDIT_ID = "auditId";

    private final HtmlDocumentParser parser;
    private final ComplianceAuditOrchestrator orchestrator;
    private final Narrator narrator;

    /**
     * @throws IllegalArgumentException when {@code url} or {@code html} is blank
     */
    public CombinedReport audit(String url, String html) {
        RequestContext context = RequestContext.fromUrl(url);
        if (html == null || html.isBlank()) {
            throw new IllegalArgumentException("html must not be blank");
        }
        DocumentNode document = parser.parse(html, url);
        return audit(document, context);
    }

    public CombinedReport audit(DocumentNode document, RequestContext context) {
        MDC.put(AUDIT_ID, UUID.randomUUID().toString());
        try {
            log.info("Audit started — {}", context.url());
            return orchestrator.runAudit(document, context, narrator);
        } catch (PipelineException e) {
            log.error("Audit failed at stage {}", e.getStage(), e);
            return CombinedReport.failed(e.getStage(), e.getMessage());
        } finally {
            MDC.remove(AUDIT_ID);
        }
    }
}
