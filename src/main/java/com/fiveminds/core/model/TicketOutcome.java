package com.fiveminds.core.model;

/**
 * Final line of the run report for one ticket.
 *
 * @param ticketId       ticket id
 * @param title          ticket title
 * @param status         status at report time
 * @param reason         why the ticket ended in that status
 * @param alignmentScore score of the last review, or {@code null} if never reviewed
 * @param followUp       whether the ticket was synthesized by the review gate
 */
public record TicketOutcome(
    String ticketId,
    String title,
    TicketStatus status,
    String reason,
    Double alignmentScore,
    boolean followUp
) {}
