package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NarrativeSection(
        @JsonProperty("scan_enhancement") ScanEnhancement scanEnhancement,
        @JsonProperty("legal_context")    LegalContext legalContext,
        @JsonProperty("risk_assessment")  MergedRiskAssessment riskAssessment,
        @JsonProperty("roadmap")          MergedRoadmap roadmap
) {}
