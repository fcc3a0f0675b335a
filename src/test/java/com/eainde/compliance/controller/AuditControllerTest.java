package com.eainde.compliance.controller;

import com.eainde.compliance.model.AuditStatus;
import com.eainde.compliance.model.CombinedReport;
import com.eainde.compliance.model.NarratorRole;
import com.eainde.compliance.model.PipelineStage;
import com.eainde.compliance.model.PriorityMatrix;
import com.eainde.compliance.model.RemediationPlan;
import com.eainde.compliance.service.ComplianceAuditService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AuditControllerTest {

    private static final String BODY = """
            {"url": "https://shop.example.com", "html": "<h1>Hi</h1>"}""";

    @Mock
    private ComplianceAuditService auditService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AuditController(auditService)).build();
    }

    @Test
    @DisplayName("POST /api/v1/audit returns the combined report as JSON")
    void audit() throws Exception {
        CombinedReport report = new CombinedReport(AuditStatus.COMPLETED, null, 100, 0,
                Map.of("critical", 0), Map.of(), List.of(), PriorityMatrix.of(List.of()), RemediationPlan.empty(),
                null, List.of(NarratorRole.values()), List.of());
        when(auditService.audit("https://shop.example.com", "<h1>Hi</h1>")).thenReturn(report);

        mockMvc.perform(post("/api/v1/audit").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.compliance_score").value(100))
                .andExpect(jsonPath("$.succeeded_roles[0]").value("scan_enhance"))
                .andExpect(jsonPath("$.failed_stage").doesNotExist());
    }

    @Test
    @DisplayName("failed audits serialise only status, stage and warnings")
    void failed() throws Exception {
        when(auditService.audit("https://shop.example.com", "<h1>Hi</h1>"))
                .thenReturn(CombinedReport.failed(PipelineStage.MAP, "map stage failed: x"));

        mockMvc.perform(post("/api/v1/audit").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.failed_stage").value("map"))
                .andExpect(jsonPath("$.compliance_score").doesNotExist());
    }

    @Test
    @DisplayName("invalid input is a 400")
    void badRequest() throws Exception {
        when(auditService.audit("https://shop.example.com", "<h1>Hi</h1>"))
                .thenThrow(new IllegalArgumentException("html must not be blank"));

        mockMvc.perform(post("/api/v1/audit").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("html must not be blank"));
    }
}
