package com.fiveminds.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a ticket.
 *
 * <p>Allowed transitions:
 * <ul>
 *   <li>PENDING → IN_PROGRESS, BLOCKED</li>
 *   <li>IN_PROGRESS → NEEDS_REVIEW, FAILED, CANCELLED</li>
 *   <li>NEEDS_REVIEW → APPROVED, REJECTED</li>
 * </ul>
 * APPROVED, REJECTED, BLOCKED, CANCELLED and FAILED are terminal.
 */
public enum TicketStatus {
    PENDING,
    IN_PROGRESS,
    NEEDS_REVIEW,
    APPROVED,
    REJECTED,
    BLOCKED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return switch (this) {
            case APPROVED, REJECTED, BLOCKED, CANCELLED, FAILED -> true;
            case PENDING, IN_PROGRESS, NEEDS_REVIEW -> false;
        };
    }

    /**
     * Terminal statuses other than APPROVED. A dependency in one of these blocks its dependents.
     */
    public boolean isTerminalFailure() {
        return isTerminal() && this != APPROVED;
    }

    public boolean canTransitionTo(TicketStatus next) {
        return allowedNext().contains(next);
    }

    public Set<TicketStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(IN_PROGRESS, BLOCKED);
            case IN_PROGRESS -> EnumSet.of(NEEDS_REVIEW, FAILED, CANCELLED);
            case NEEDS_REVIEW -> EnumSet.of(APPROVED, REJECTED);
            case APPROVED, REJECTED, BLOCKED, CANCELLED, FAILED -> EnumSet.noneOf(TicketStatus.class);
        };
    }
}
