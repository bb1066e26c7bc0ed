package com.fiveminds.core.model;

/**
 * Result of the final test run on the integrated repository.
 */
public record FinalTestOutcome(boolean passed, String summary) {

    public static FinalTestOutcome notRun(String reason) {
        return new FinalTestOutcome(false, reason);
    }
}
