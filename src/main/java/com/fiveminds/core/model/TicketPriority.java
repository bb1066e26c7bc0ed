package com.fiveminds.core.model;

/**
 * Priority level of a ticket. Informational only: wave ordering never looks at it.
 */
public enum TicketPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
