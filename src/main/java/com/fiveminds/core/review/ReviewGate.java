package com.fiveminds.core.review;

import com.fiveminds.core.model.AcceptanceCriterion;
import com.fiveminds.core.model.ExecutionResult;
import com.fiveminds.core.model.LogEntry;
import com.fiveminds.core.model.Objective;
import com.fiveminds.core.model.ReviewSummary;
import com.fiveminds.core.model.ReviewVerdict;
import com.fiveminds.core.model.TestSummary;
import com.fiveminds.core.model.Ticket;
import com.fiveminds.core.model.TicketPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scores execution results and decides which may be integrated.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Compute the alignment score from success, criteria coverage and test evidence</li>
 *   <li>Approve only successful results whose criteria are all met and whose score reaches the threshold</li>
 *   <li>Report risk findings and suggestions, which never affect the score</li>
 *   <li>Synthesize follow-up tickets for the gaps the result leaves</li>
 * </ul>
 * Every call recomputes the score from the result; nothing is cached.
 */
@Service
public class ReviewGate implements ReviewerPort {

    private static final Logger log = LoggerFactory.getLogger(ReviewGate.class);

    public static final double DEFAULT_APPROVAL_THRESHOLD = 0.7;

    static final double SUCCESS_WEIGHT = 0.30;
    static final double CRITERIA_WEIGHT = 0.40;
    static final double TEST_WEIGHT = 0.30;
    /** Test component when the result carries no test evidence at all. */
    static final double NO_TEST_EVIDENCE_CREDIT = 0.15;

    private static final Duration LONG_EXECUTION = Duration.ofMinutes(5);

    private static final Pattern FOLLOW_UP_LOG_PATTERN =
            Pattern.compile("\\bTODO\\b|follow-up", Pattern.CASE_INSENSITIVE);

    private final DiffAnalyzer diffAnalyzer;
    private final double defaultThreshold;

    @Autowired
    public ReviewGate(DiffAnalyzer diffAnalyzer,
                      @Value("${fiveminds.run.approval-threshold:0.7}") double defaultThreshold) {
        if (defaultThreshold < 0.0 || defaultThreshold > 1.0) {
            throw new IllegalArgumentException("Approval threshold must be within [0, 1]: " + defaultThreshold);
        }
        this.diffAnalyzer = diffAnalyzer;
        this.defaultThreshold = defaultThreshold;
    }

    public ReviewGate() {
        this(new DiffAnalyzer(), DEFAULT_APPROVAL_THRESHOLD);
    }

    @Override
    public ReviewVerdict review(Ticket ticket, ExecutionResult result, Objective objective) {
        return review(ticket, result, objective, defaultThreshold);
    }

    @Override
    public ReviewVerdict review(Ticket ticket, ExecutionResult result, Objective objective, double approvalThreshold) {
        if (!ticket.id().equals(result.ticketId())) {
            throw new IllegalArgumentException(
                    "Result for " + result.ticketId() + " cannot be reviewed against ticket " + ticket.id());
        }
        double score = alignmentScore(ticket, result);
        boolean approved = result.success() && ticket.allCriteriaMet() && score >= approvalThreshold;

        var feedback = feedback(ticket, result, score, approvalThreshold, approved);
        var risks = riskFindings(result);
        var suggestions = suggestions(result, objective, approved);
        List<Ticket> followUps = result.cancelled()
                ? List.of()
                : followUps(ticket, result, approved, feedback);

        log.info("Reviewed ticket {}: score {} (threshold {}) → {}, {} follow-ups",
                ticket.id(), format(score), format(approvalThreshold),
                approved ? "APPROVED" : "REJECTED", followUps.size());
        return new ReviewVerdict(ticket.id(), approved, score, feedback, risks, suggestions, followUps);
    }

    /**
     * Weighted score in [0, 1]: success, fraction of criteria met, and test pass ratio.
     */
    public double alignmentScore(Ticket ticket, ExecutionResult result) {
        double score = result.success() ? SUCCESS_WEIGHT : 0.0;

        int totalCriteria = ticket.acceptanceCriteria().size();
        double criteriaRatio = totalCriteria == 0 ? 1.0 : (double) ticket.criteriaMetCount() / totalCriteria;
        score += CRITERIA_WEIGHT * criteriaRatio;

        TestSummary tests = result.testSummary();
        if (tests == null) {
            score += NO_TEST_EVIDENCE_CREDIT;
        } else if (tests.total() > 0) {
            score += TEST_WEIGHT * tests.passRatio();
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    public ReviewSummary summarize(Collection<ReviewVerdict> verdicts) {
        return ReviewSummary.of(verdicts);
    }

    private String feedback(Ticket ticket, ExecutionResult result, double score, double threshold, boolean approved) {
        var lines = new ArrayList<String>();
        lines.add(result.success()
                ? "Execution succeeded"
                : "Execution failed (" + result.errorKind() + "): " + result.errorMessage());
        lines.add("Criteria met: " + ticket.criteriaMetCount() + "/" + ticket.acceptanceCriteria().size());
        for (AcceptanceCriterion unmet : ticket.unmetCriteria()) {
            lines.add("  missing: " + unmet.description());
        }
        TestSummary tests = result.testSummary();
        if (tests == null) {
            lines.add("No test evidence reported");
        } else {
            lines.add("Tests: %d passed, %d failed, %d skipped".formatted(tests.passed(), tests.failed(), tests.skipped()));
        }
        lines.add("Alignment score: " + format(score) + " (threshold " + format(threshold) + ")");
        lines.add(approved ? "Verdict: APPROVED" : "Verdict: REJECTED");
        return String.join("\n", lines);
    }

    private List<String> riskFindings(ExecutionResult result) {
        var findings = new ArrayList<String>();
        if (!result.success()) {
            findings.add("Execution failed: " + result.errorMessage());
        }
        TestSummary tests = result.testSummary();
        if (tests != null && tests.failed() > 0) {
            findings.add(tests.failed() + " failing test(s)");
        }
        if (tests != null && tests.skipped() > 0) {
            findings.add(tests.skipped() + " skipped test(s)");
        }
        if (result.success()) {
            findings.addAll(diffAnalyzer.findings(diffAnalyzer.analyze(result.diff())));
        }
        return findings;
    }

    private List<String> suggestions(ExecutionResult result, Objective objective, boolean approved) {
        var suggestions = new ArrayList<String>();
        if (!approved) {
            suggestions.add("Revise the change to meet every acceptance criterion and make all tests pass");
        }
        if (result.duration().compareTo(LONG_EXECUTION) > 0) {
            suggestions.add("Execution took " + result.duration().toMinutes()
                    + " minutes; consider breaking the ticket into smaller tasks");
        }
        if (objective != null && !objective.description().isBlank()) {
            suggestions.add("Keep the change aligned with the objective: " + objective.description());
        }
        return suggestions;
    }

    private List<Ticket> followUps(Ticket parent, ExecutionResult result, boolean approved, String feedback) {
        var followUps = new ArrayList<Ticket>();
        var ids = new FollowUpIds(parent.id());

        for (AcceptanceCriterion unmet : parent.unmetCriteria()) {
            followUps.add(Ticket.builder(ids.next())
                    .title("Complete criterion: " + unmet.description())
                    .description("Ticket " + parent.id() + " did not meet: " + unmet.description())
                    .criterion(unmet.description())
                    .priority(parent.priority())
                    .followUpOf(parent)
                    .build());
        }

        TestSummary tests = result.testSummary();
        if (tests != null && tests.failed() > 0) {
            followUps.add(Ticket.builder(ids.next())
                    .title("Fix test failures in " + parent.id())
                    .description(tests.failed() + " of " + tests.total() + " tests failed for " + parent.title())
                    .criterion("All tests pass")
                    .priority(TicketPriority.HIGH)
                    .followUpOf(parent)
                    .build());
        }

        if (!approved && followUps.isEmpty()) {
            followUps.add(Ticket.builder(ids.next())
                    .title("Revise " + parent.title())
                    .description(feedback)
                    .criterion("Address review feedback for " + parent.id())
                    .priority(parent.priority())
                    .followUpOf(parent)
                    .build());
        }

        for (LogEntry entry : result.logs()) {
            if (FOLLOW_UP_LOG_PATTERN.matcher(entry.message()).find()) {
                followUps.add(Ticket.builder(ids.next())
                        .title("Follow up: " + abbreviate(entry.message()))
                        .description("Raised in the execution log of " + parent.id() + ": " + entry.message())
                        .criterion("Resolve: " + entry.message().trim())
                        .priority(TicketPriority.LOW)
                        .followUpOf(parent)
                        .build());
            }
        }
        return followUps;
    }

    private static String abbreviate(String text) {
        String trimmed = text.trim();
        return trimmed.length() <= 60 ? trimmed : trimmed.substring(0, 57) + "...";
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /** Sequential {@code <parent>-FU-<n>} ids. */
    private static final class FollowUpIds {
        private final String parentId;
        private int next = 1;

        FollowUpIds(String parentId) {
            this.parentId = parentId;
        }

        String next() {
            return parentId + "-FU-" + next++;
        }
    }
}
