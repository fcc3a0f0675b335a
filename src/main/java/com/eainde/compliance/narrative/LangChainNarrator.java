package com.eainde.compliance.narrative;

import com.eainde.compliance.model.NarratorRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

/**
 * {@link Narrator} backed by the {@link ComplianceNarratorAgent} AI service.
 */
@Log4j2
@RequiredArgsConstructor
public class LangChainNarrator implements Narrator {

    private final ComplianceNarratorAgent agent;

    @Override
    public String ask(NarratorRole role, String context) {
        log.debug("Asking narrator role {} ({} chars of context)", role, context.length());
        return switch (role) {
            case SCAN_ENHANCE -> agent.enhanceScan(context);
            case LEGAL_CONTEXT -> agent.legalContext(context);
            case RISK_ASSESSMENT -> agent.assessRisk(context);
            case ROADMAP -> agent.planRoadmap(context);
        };
    }
}
