package com.fiveminds.core.model;

import java.util.Map;

/**
 * Point-in-time view of a run in progress.
 */
public record RunStatus(
    String runId,
    RunPhase phase,
    int wave,
    int generation,
    int totalTickets,
    Map<TicketStatus, Integer> ticketsByStatus,
    int results,
    int reviews
) {}
