package com.fiveminds.core.model;

import java.util.List;

/**
 * The review gate's decision for one execution result. Immutable.
 *
 * @param ticketId        the reviewed ticket
 * @param approved        whether the result may be integrated
 * @param alignmentScore  weighted score in [0, 1]
 * @param feedback        human-readable review notes, one per line
 * @param riskFindings    heuristic flags for downstream attention; never affect the score
 * @param suggestions     improvement hints
 * @param followUpTickets tickets synthesized to address gaps in this result
 */
public record ReviewVerdict(
    String ticketId,
    boolean approved,
    double alignmentScore,
    String feedback,
    List<String> riskFindings,
    List<String> suggestions,
    List<Ticket> followUpTickets
) {

    public ReviewVerdict {
        if (alignmentScore < 0.0 || alignmentScore > 1.0 || Double.isNaN(alignmentScore)) {
            throw new IllegalArgumentException("Alignment score out of range: " + alignmentScore);
        }
        riskFindings = riskFindings != null ? List.copyOf(riskFindings) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
        followUpTickets = followUpTickets != null ? List.copyOf(followUpTickets) : List.of();
    }
}
