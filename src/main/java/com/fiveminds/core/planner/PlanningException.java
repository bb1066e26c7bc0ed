package com.fiveminds.core.planner;

import com.fiveminds.core.FiveMindsException;

/**
 * Thrown when no executable ticket graph can be produced from an objective.
 * Fatal to the run: nothing is dispatched.
 */
public class PlanningException extends FiveMindsException {

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
