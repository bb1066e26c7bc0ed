package com.fiveminds.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one execution attempt of a ticket. Produced exactly once per attempt
 * and immutable after creation.
 *
 * @param ticketId     the ticket that was executed
 * @param success      whether the implementer reported success
 * @param diff         opaque change payload produced by the implementer
 * @param logs         ordered execution log
 * @param testSummary  test counts, or {@code null} when no test evidence was reported
 * @param errorMessage error detail when {@code success} is false
 * @param errorKind    error classification, {@code null} on success
 * @param duration     wall-clock time of the attempt
 * @param metCriteria  descriptions of the acceptance criteria the implementer reports as met
 */
public record ExecutionResult(
    String ticketId,
    boolean success,
    String diff,
    List<LogEntry> logs,
    TestSummary testSummary,
    String errorMessage,
    ExecutionErrorKind errorKind,
    Duration duration,
    Set<String> metCriteria
) {

    public ExecutionResult {
        diff = diff != null ? diff : "";
        logs = logs != null ? List.copyOf(logs) : List.of();
        duration = duration != null ? duration : Duration.ZERO;
        metCriteria = metCriteria != null ? Set.copyOf(metCriteria) : Set.of();
    }

    public static ExecutionResult success(String ticketId, String diff, List<LogEntry> logs,
                                          TestSummary testSummary, Duration duration,
                                          Set<String> metCriteria) {
        return new ExecutionResult(ticketId, true, diff, logs, testSummary, null, null, duration, metCriteria);
    }

    public static ExecutionResult failure(String ticketId, ExecutionErrorKind kind, String errorMessage,
                                          List<LogEntry> logs, Duration duration) {
        return new ExecutionResult(ticketId, false, "", logs, null, errorMessage, kind, duration, Set.of());
    }

    public boolean cancelled() {
        return errorKind == ExecutionErrorKind.CANCELLED;
    }

    public boolean timedOut() {
        return errorKind == ExecutionErrorKind.EXECUTION_TIMEOUT;
    }

    /**
     * Returns a copy carrying the given wall-clock duration.
     */
    public ExecutionResult withDuration(Duration measured) {
        return new ExecutionResult(ticketId, success, diff, logs, testSummary, errorMessage, errorKind,
                measured, metCriteria);
    }

    /**
     * Returns a copy with {@code prefix} log entries placed before this result's own entries.
     */
    public ExecutionResult withLeadingLogs(List<LogEntry> prefix) {
        if (prefix == null || prefix.isEmpty()) return this;
        var merged = new java.util.ArrayList<LogEntry>(prefix.size() + logs.size());
        merged.addAll(prefix);
        merged.addAll(logs);
        return new ExecutionResult(ticketId, success, diff, merged, testSummary, errorMessage, errorKind,
                duration, metCriteria);
    }
}
