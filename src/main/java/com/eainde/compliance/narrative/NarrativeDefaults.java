package com.eainde.compliance.narrative;

import com.eainde.compliance.model.ComplianceReport;
import com.eainde.compliance.model.ImplementationRoadmap;
import com.eainde.compliance.model.LegalContext;
import com.eainde.compliance.model.NarrativeRecord;
import com.eainde.compliance.model.NarratorRole;
import com.eainde.compliance.model.RecordSource;
import com.eainde.compliance.model.RiskAssessment;
import com.eainde.compliance.model.ScanEnhancement;

import java.util.List;
import java.util.Map;

/**
 * Conservative per-role records used when neither the strict nor the heuristic tier yields
 * anything: empty lists and a non-empty summary.
 */
public final class NarrativeDefaults {

    static final String DEFAULT_BUSINESS_IMPACT =
            "Compliance violations may impact business operations and user trust";

    private NarrativeDefaults() {}

    public static NarrativeRecord forRole(NarratorRole role) {
        return switch (role) {
            case SCAN_ENHANCE -> scanEnhancement();
            case LEGAL_CONTEXT -> legalContext();
            case RISK_ASSESSMENT -> riskAssessment();
            case ROADMAP -> roadmap();
        };
    }

    public static ScanEnhancement scanEnhancement() {
        return new ScanEnhancement(List.of(), Map.of(), ComplianceReport.emptySeverityBreakdown(),
                "No additional findings beyond the technical scan.", RecordSource.NARRATIVE_DEFAULT);
    }

    public static LegalContext legalContext() {
        return new LegalContext(List.of(), List.of(), List.of(), List.of(), List.of(),
                "No legal context available; refer to the citations attached to each issue.",
                RecordSource.NARRATIVE_DEFAULT);
    }

    public static RiskAssessment riskAssessment() {
        return new RiskAssessment("medium", List.of(), List.of(), DEFAULT_BUSINESS_IMPACT,
                "Risk assessment unavailable; the technical severity distribution applies.",
                RecordSource.NARRATIVE_DEFAULT);
    }

    public static ImplementationRoadmap roadmap() {
        return new ImplementationRoadmap(List.of(), List.of(), List.of(), List.of(),
                "No narrative roadmap available; follow the technical remediation phases.",
                RecordSource.NARRATIVE_DEFAULT);
    }
}
