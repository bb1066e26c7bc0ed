package com.fiveminds.core.review;

import com.fiveminds.core.model.ExecutionResult;
import com.fiveminds.core.model.Objective;
import com.fiveminds.core.model.ReviewVerdict;
import com.fiveminds.core.model.Ticket;

/**
 * Judges one execution result against its ticket.
 */
public interface ReviewerPort {

    ReviewVerdict review(Ticket ticket, ExecutionResult result, Objective objective);

    /**
     * Reviews with a run-specific approval threshold. Reviewers without a numeric
     * threshold may ignore it.
     */
    default ReviewVerdict review(Ticket ticket, ExecutionResult result, Objective objective, double approvalThreshold) {
        return review(ticket, result, objective);
    }
}
