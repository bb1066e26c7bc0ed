package com.fiveminds.core.model;

import java.util.Collection;

/**
 * Aggregate statistics over all review verdicts of a run.
 */
public record ReviewSummary(
    int totalReviews,
    int approved,
    int rejected,
    double approvalRate,
    double averageAlignmentScore,
    int totalFollowUpTickets
) {

    public static ReviewSummary empty() {
        return new ReviewSummary(0, 0, 0, 0.0, 0.0, 0);
    }

    public static ReviewSummary of(Collection<ReviewVerdict> verdicts) {
        if (verdicts.isEmpty()) {
            return empty();
        }
        int total = verdicts.size();
        int approved = (int) verdicts.stream().filter(ReviewVerdict::approved).count();
        double average = verdicts.stream().mapToDouble(ReviewVerdict::alignmentScore).average().orElse(0.0);
        int followUps = verdicts.stream().mapToInt(v -> v.followUpTickets().size()).sum();
        return new ReviewSummary(total, approved, total - approved, (double) approved / total, average, followUps);
    }
}
