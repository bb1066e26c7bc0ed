package com.fiveminds.core.model;

/**
 * Why an execution did not succeed. All kinds are scoped to one ticket.
 */
public enum ExecutionErrorKind {
    /** The implementer reported failure or threw. */
    EXECUTION_FAILURE,
    /** The per-ticket timeout elapsed before the implementer returned. */
    EXECUTION_TIMEOUT,
    /** No sandbox could be prepared for the ticket. */
    SANDBOX_ACQUISITION_FAILURE,
    /** The ticket was cancelled on request. Not an error condition. */
    CANCELLED
}
