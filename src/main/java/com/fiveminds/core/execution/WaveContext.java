package com.fiveminds.core.execution;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Per-wave settings handed to {@link ExecutionCoordinator#runWave(WaveContext, List, ImplementerPort, int)}.
 *
 * @param runId        run the wave belongs to, used for events and logging
 * @param waveNumber   1-based wave counter within the run
 * @param baseSnapshot directory each sandbox is copied from, or {@code null}
 * @param constraints  objective constraints passed to the implementer
 * @param timeout      per-ticket execution limit
 * @param stopRequested checked by workers before each invocation; true cancels the ticket
 */
public record WaveContext(
    String runId,
    int waveNumber,
    Path baseSnapshot,
    List<String> constraints,
    Duration timeout,
    BooleanSupplier stopRequested
) {

    public WaveContext {
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Ticket timeout must be positive: " + timeout);
        }
        stopRequested = stopRequested != null ? stopRequested : () -> false;
    }

    public WaveContext(String runId, int waveNumber, Path baseSnapshot, List<String> constraints, Duration timeout) {
        this(runId, waveNumber, baseSnapshot, constraints, timeout, null);
    }
}
