package com.fiveminds.core.model;

import java.util.List;

/**
 * Result of handing the approved diffs to the integrator.
 *
 * @param success        whether every approved change was integrated
 * @param patchesApplied number of approved results handed over
 * @param log            integrator log lines
 */
public record IntegrationOutcome(boolean success, int patchesApplied, List<String> log) {

    public IntegrationOutcome {
        log = log != null ? List.copyOf(log) : List.of();
    }

    public static IntegrationOutcome failed(int patches, String reason) {
        return new IntegrationOutcome(false, patches, List.of(reason));
    }

    public static IntegrationOutcome skipped(String reason) {
        return new IntegrationOutcome(false, 0, List.of(reason));
    }
}
