package com.fiveminds.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final report of an orchestration run. Always produced, including after a fatal
 * planning error (then with an empty ticket list and {@code fatalReason} set).
 */
public record RunReport(
    String runId,
    String objective,
    RunPhase finalPhase,
    String fatalReason,
    List<TicketOutcome> tickets,
    Map<TicketStatus, Integer> statusCounts,
    ReviewSummary reviewSummary,
    double aggregateAlignment,
    IntegrationOutcome integration,
    FinalTestOutcome finalTests,
    List<TicketOutcome> deferredFollowUps,
    int wavesExecuted,
    int generationsExecuted,
    RepositoryContext repository,
    Instant startedAt,
    Instant finishedAt
) {

    public RunReport {
        tickets = tickets != null ? List.copyOf(tickets) : List.of();
        statusCounts = statusCounts != null ? Map.copyOf(statusCounts) : Map.of();
        deferredFollowUps = deferredFollowUps != null ? List.copyOf(deferredFollowUps) : List.of();
    }

    public boolean succeeded() {
        return finalPhase == RunPhase.COMPLETED;
    }

    public int count(TicketStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }

    public TicketOutcome outcome(String ticketId) {
        return tickets.stream()
                .filter(t -> t.ticketId().equals(ticketId))
                .findFirst()
                .orElse(null);
    }
}
