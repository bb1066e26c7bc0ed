package com.fiveminds.core.events;

import com.fiveminds.core.model.Ticket;
import com.fiveminds.core.model.TicketStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A lifecycle event emitted during a run, consumed by dashboards and log tailers.
 *
 * @param eventType one of the {@code *} constants below (e.g. "ticket.status", "wave.started")
 * @param runId     the run this event belongs to
 * @param entityId  the ticket or wave this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record FiveMindsEvent(
    String eventType,
    String runId,
    String entityId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String RUN_PHASE = "run.phase";
    public static final String TICKET_CREATED = "ticket.created";
    public static final String TICKET_STATUS = "ticket.status";
    public static final String WAVE_STARTED = "wave.started";
    public static final String WAVE_COMPLETED = "wave.completed";
    public static final String EXECUTION_LOG = "execution.log";
    public static final String REVIEW_VERDICT = "review.verdict";

    public FiveMindsEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static FiveMindsEvent of(String eventType, String runId, String entityId, Map<String, Object> payload) {
        return new FiveMindsEvent(eventType, runId, entityId, payload, Instant.now());
    }

    /**
     * A {@code ticket.status} event for a transition that just happened.
     */
    public static FiveMindsEvent ticketStatus(String runId, Ticket ticket, TicketStatus previous) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", ticket.status().name());
        payload.put("previous", previous.name());
        payload.put("reason", ticket.statusReason());
        return of(TICKET_STATUS, runId, ticket.id(), payload);
    }
}
