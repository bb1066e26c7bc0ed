package com.fiveminds.core.execution;

import com.fiveminds.core.model.Ticket;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Everything an implementer receives for one execution attempt.
 *
 * @param ticket      the ticket to implement
 * @param workspace   the sandbox directory the implementer owns for this attempt
 * @param constraints objective constraints to respect
 * @param logSink     streams execution log lines to observers as they happen
 */
public record ImplementationRequest(
    Ticket ticket,
    Path workspace,
    List<String> constraints,
    Consumer<String> logSink
) {

    public ImplementationRequest {
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        logSink = logSink != null ? logSink : line -> {};
    }

    public void log(String line) {
        logSink.accept(line);
    }
}
