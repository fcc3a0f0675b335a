package com.eainde.compliance.pipeline;

/**
 * The audit thread was interrupted while waiting for a narrator. The interrupt flag is
 * restored before this is thrown.
 */
public class AuditCancelledException extends RuntimeException {

    public AuditCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
