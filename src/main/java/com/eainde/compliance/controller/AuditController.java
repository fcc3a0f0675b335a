package com.eainde.compliance.controller;

import com.eainde.compliance.model.CombinedReport;
import com.eainde.compliance.service.ComplianceAuditService;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Log4j2
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AuditController {

    private final ComplianceAuditService auditService;

    @PostMapping("/audit")
    public CombinedReport audit(@RequestBody AuditRequest request) {
        return auditService.audit(request.url(), request.html());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Rejected audit request — {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    public record AuditRequest(
            @JsonProperty("url")  String url,
            @JsonProperty("html") String html
    ) {
    }
}
