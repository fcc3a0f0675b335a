package com.eainde.compliance.narrative;

import com.eainde.compliance.model.NarratorRole;

/**
 * Narrator used when no model API key is configured. Every role fails, so audits complete
 * with technical results only and status {@code partial}.
 */
public class UnavailableNarrator implements Narrator {

    private final String reason;

    public UnavailableNarrator(String reason) {
        this.reason = reason;
    }

    @Override
    public String ask(NarratorRole role, String context) {
        throw new NarratorUnavailableException("Narrator unavailable for " + role + ": " + reason);
    }
}
