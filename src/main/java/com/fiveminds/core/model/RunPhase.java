package com.fiveminds.core.model;

/**
 * Phase of an orchestration run.
 */
public enum RunPhase {
    PLANNING,
    EXECUTING,
    REVIEWING,
    INTEGRATING,
    COMPLETED,
    FAILED;

    public boolean isFinal() {
        return this == COMPLETED || this == FAILED;
    }
}
