package com.fiveminds.core.engine;

import com.fiveminds.core.FiveMindsException;

/**
 * Thrown by an integrator that could not apply the approved changes.
 * Recorded in the run report; never changes ticket verdicts.
 */
public class IntegrationException extends FiveMindsException {

    public IntegrationException(String message) {
        super(message);
    }

    public IntegrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
