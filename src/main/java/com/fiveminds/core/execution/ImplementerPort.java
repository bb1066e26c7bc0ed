package com.fiveminds.core.execution;

import com.fiveminds.core.model.ExecutionResult;

/**
 * The capability that turns a ticket into a change inside a sandbox.
 * <p>
 * Implementations must respond to thread interruption: the coordinator interrupts
 * the invoking thread on timeout and on cancellation. Exceptions thrown here are
 * recorded as {@code EXECUTION_FAILURE} results, never retried.
 */
@FunctionalInterface
public interface ImplementerPort {

    ExecutionResult implement(ImplementationRequest request) throws Exception;
}
