package com.fiveminds.sandbox;

import com.fiveminds.core.FiveMindsException;

/**
 * Thrown when a sandbox cannot be prepared for a ticket. Scoped to that ticket.
 */
public class SandboxAcquisitionException extends FiveMindsException {

    public SandboxAcquisitionException(String message) {
        super(message);
    }

    public SandboxAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
