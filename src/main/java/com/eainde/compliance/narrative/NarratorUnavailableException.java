package com.eainde.compliance.narrative;

/**
 * Thrown by a narrator that cannot serve requests, e.g. because no model is configured.
 */
public class NarratorUnavailableException extends RuntimeException {

    public NarratorUnavailableException(String message) {
        super(message);
    }
}
