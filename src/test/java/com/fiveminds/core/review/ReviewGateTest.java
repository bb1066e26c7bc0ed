package com.fiveminds.core.review;

import com.fiveminds.core.model.ExecutionErrorKind;
import com.fiveminds.core.model.ExecutionResult;
import com.fiveminds.core.model.LogEntry;
import com.fiveminds.core.model.Objective;
import com.fiveminds.core.model.ReviewVerdict;
import com.fiveminds.core.model.TestSummary;
import com.fiveminds.core.model.Ticket;
import com.fiveminds.core.model.TicketPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReviewGateTest {

    private static final Objective OBJECTIVE = new Objective("Add user login", List.of("Login form", "Session store"));
    private static final Set<String> ALL_CRITERIA = Set.of("Form renders", "Credentials validated", "Docs updated");
    private static final String DIFF = """
            --- a/login.py
            +++ b/login.py
            @@ -1,2 +1,3 @@
            +def login(user, password):
            +    return check(user, password)
            -pass
            """;

    private ReviewGate gate;
    private Ticket ticket;

    @BeforeEach
    void setUp() {
        gate = new ReviewGate();
        ticket = Ticket.builder("TKT-001")
                .title("Login form")
                .criteria(List.of("Form renders", "Credentials validated", "Docs updated"))
                .priority(TicketPriority.MEDIUM)
                .build();
    }

    private ExecutionResult success(TestSummary tests, Set<String> met) {
        ticket.applyCriteriaReport(met, "implementer");
        return ExecutionResult.success("TKT-001", DIFF, List.of(), tests, Duration.ofSeconds(30), met);
    }

    @Nested
    @DisplayName("alignment score")
    class Score {

        @Test
        @DisplayName("all criteria met with 8 of 10 tests passing scores 0.94 and is approved")
        void weightedExample() {
            var verdict = gate.review(ticket, success(new TestSummary(8, 2, 0), ALL_CRITERIA), OBJECTIVE);

            assertEquals(0.94, verdict.alignmentScore(), 1e-9);
            assertTrue(verdict.approved());
            assertTrue(verdict.feedback().contains("Alignment score: 0.94 (threshold 0.70)"));
        }

        @Test
        @DisplayName("missing test evidence earns half the test weight")
        void noTestEvidence() {
            var verdict = gate.review(ticket, success(null, ALL_CRITERIA), OBJECTIVE);

            assertEquals(0.85, verdict.alignmentScore(), 1e-9);
            assertTrue(verdict.feedback().contains("No test evidence reported"));
        }

        @Test
        @DisplayName("a zero-test summary earns no test credit")
        void zeroTests() {
            var verdict = gate.review(ticket, success(new TestSummary(0, 0, 0), ALL_CRITERIA), OBJECTIVE);

            assertEquals(0.70, verdict.alignmentScore(), 1e-9);
            assertTrue(verdict.feedback().contains("Tests: 0 passed, 0 failed, 0 skipped"));
        }

        @Test
        @DisplayName("a ticket without criteria counts as fully covered")
        void noCriteria() {
            var bare = Ticket.builder("TKT-009").title("Bare").build();
            var result = ExecutionResult.success("TKT-009", DIFF, List.of(), new TestSummary(4, 0, 0),
                    Duration.ZERO, Set.of());

            assertEquals(1.0, gate.alignmentScore(bare, result), 1e-9);
        }

        @Test
        @DisplayName("score stays within [0, 1] for a failed result with nothing met")
        void bounds() {
            var result = ExecutionResult.failure("TKT-001", ExecutionErrorKind.EXECUTION_FAILURE, "boom",
                    List.of(), Duration.ZERO);

            double score = gate.alignmentScore(ticket, result);

            assertTrue(score >= 0.0 && score <= 1.0);
            assertEquals(0.15, score, 1e-9);
        }
    }

    @Nested
    @DisplayName("approval")
    class Approval {

        @Test
        @DisplayName("a failed execution is never approved, even with a zero threshold")
        void failureNeverApproved() {
            ticket.applyCriteriaReport(ALL_CRITERIA, "implementer");
            var result = new ExecutionResult("TKT-001", false, DIFF, List.of(), new TestSummary(10, 0, 0),
                    "linker error", ExecutionErrorKind.EXECUTION_FAILURE, Duration.ZERO, ALL_CRITERIA);

            var verdict = gate.review(ticket, result, OBJECTIVE, 0.0);

            assertFalse(verdict.approved());
            assertTrue(verdict.feedback().startsWith("Execution failed (EXECUTION_FAILURE): linker error"));
            assertTrue(verdict.riskFindings().contains("Execution failed: linker error"));
        }

        @Test
        @DisplayName("an unmet criterion blocks approval regardless of score")
        void unmetCriterion() {
            var verdict = gate.review(ticket,
                    success(new TestSummary(10, 0, 0), Set.of("Form renders", "Credentials validated")),
                    OBJECTIVE, 0.5);

            assertFalse(verdict.approved());
            assertTrue(verdict.feedback().contains("Criteria met: 2/3"));
            assertTrue(verdict.feedback().contains("  missing: Docs updated"));
        }

        @Test
        @DisplayName("a score below the threshold is rejected")
        void belowThreshold() {
            var verdict = gate.review(ticket, success(new TestSummary(8, 2, 0), ALL_CRITERIA), OBJECTIVE, 0.95);

            assertFalse(verdict.approved());
            assertTrue(verdict.feedback().endsWith("Verdict: REJECTED"));
        }

        @Test
        @DisplayName("a result for another ticket is refused")
        void mismatchedTicket() {
            var result = ExecutionResult.success("TKT-002", DIFF, List.of(), null, Duration.ZERO, Set.of());

            assertThrows(IllegalArgumentException.class, () -> gate.review(ticket, result, OBJECTIVE));
        }

        @Test
        @DisplayName("an out-of-range default threshold is refused")
        void invalidThreshold() {
            assertThrows(IllegalArgumentException.class, () -> new ReviewGate(new DiffAnalyzer(), 1.5));
        }
    }

    @Nested
    @DisplayName("follow-ups")
    class FollowUps {

        @Test
        @DisplayName("one follow-up per unmet criterion, depending on the parent")
        void unmetCriteria() {
            var verdict = gate.review(ticket, success(new TestSummary(5, 0, 0), Set.of("Form renders")), OBJECTIVE);

            var followUps = verdict.followUpTickets();
            assertEquals(2, followUps.size());
            assertEquals("TKT-001-FU-1", followUps.get(0).id());
            assertEquals("Complete criterion: Credentials validated", followUps.get(0).title());
            assertEquals("TKT-001-FU-2", followUps.get(1).id());
            for (Ticket followUp : followUps) {
                assertTrue(followUp.isFollowUp());
                assertEquals("TKT-001", followUp.parentTicketId());
                assertEquals(1, followUp.generation());
                assertTrue(followUp.dependencies().contains("TKT-001"));
                assertEquals(TicketPriority.MEDIUM, followUp.priority());
            }
        }

        @Test
        @DisplayName("failing tests produce a HIGH priority fix ticket")
        void failingTests() {
            var verdict = gate.review(ticket, success(new TestSummary(8, 2, 0), ALL_CRITERIA), OBJECTIVE);

            assertEquals(1, verdict.followUpTickets().size());
            var fix = verdict.followUpTickets().get(0);
            assertEquals("Fix test failures in TKT-001", fix.title());
            assertEquals(TicketPriority.HIGH, fix.priority());
            assertEquals("All tests pass", fix.acceptanceCriteria().get(0).description());
        }

        @Test
        @DisplayName("a rejection with no other gap produces a revision ticket")
        void revision() {
            ticket.applyCriteriaReport(ALL_CRITERIA, "implementer");
            var result = ExecutionResult.failure("TKT-001", ExecutionErrorKind.EXECUTION_TIMEOUT,
                    "Execution exceeded timeout of 300s", List.of(), Duration.ofMinutes(5));

            var verdict = gate.review(ticket, result, OBJECTIVE);

            assertEquals(1, verdict.followUpTickets().size());
            assertEquals("Revise Login form", verdict.followUpTickets().get(0).title());
        }

        @Test
        @DisplayName("TODO and follow-up log lines become LOW priority tickets")
        void fromLogs() {
            ticket.applyCriteriaReport(ALL_CRITERIA, "implementer");
            var result = ExecutionResult.success("TKT-001", DIFF,
                    List.of(LogEntry.now("compiled"), LogEntry.now("TODO: rate-limit login attempts"),
                            LogEntry.now("Needs a follow-up for password reset")),
                    new TestSummary(3, 0, 0), Duration.ZERO, ALL_CRITERIA);

            var verdict = gate.review(ticket, result, OBJECTIVE);

            assertTrue(verdict.approved());
            assertEquals(2, verdict.followUpTickets().size());
            assertTrue(verdict.followUpTickets().stream().allMatch(t -> t.priority() == TicketPriority.LOW));
            assertEquals("Follow up: TODO: rate-limit login attempts", verdict.followUpTickets().get(0).title());
        }

        @Test
        @DisplayName("a cancelled result produces no follow-ups")
        void cancelled() {
            var result = ExecutionResult.failure("TKT-001", ExecutionErrorKind.CANCELLED, "Run was stopped",
                    List.of(), Duration.ZERO);

            var verdict = gate.review(ticket, result, OBJECTIVE);

            assertFalse(verdict.approved());
            assertTrue(verdict.followUpTickets().isEmpty());
        }
    }

    @Nested
    @DisplayName("risks and suggestions")
    class RisksAndSuggestions {

        @Test
        @DisplayName("flags debug output and failing tests without changing the score")
        void risks() {
            ticket.applyCriteriaReport(ALL_CRITERIA, "implementer");
            String noisy = "+++ b/app.js\n+console.log(user)\n+// TODO validate\n";
            var result = ExecutionResult.success("TKT-001", noisy, List.of(), new TestSummary(8, 1, 1),
                    Duration.ZERO, ALL_CRITERIA);
            var clean = ExecutionResult.success("TKT-001", DIFF, List.of(), new TestSummary(8, 1, 1),
                    Duration.ZERO, ALL_CRITERIA);

            var verdict = gate.review(ticket, result, OBJECTIVE);

            assertTrue(verdict.riskFindings().contains("1 failing test(s)"));
            assertTrue(verdict.riskFindings().contains("1 skipped test(s)"));
            assertTrue(verdict.riskFindings().contains("Debug statements added (1)"));
            assertTrue(verdict.riskFindings().contains("TODO/FIXME markers added (1)"));
            assertEquals(gate.alignmentScore(ticket, clean), verdict.alignmentScore(), 1e-9);
        }

        @Test
        @DisplayName("suggests splitting long tickets and restates the objective")
        void suggestions() {
            ticket.applyCriteriaReport(ALL_CRITERIA, "implementer");
            var result = ExecutionResult.success("TKT-001", DIFF, List.of(), new TestSummary(2, 0, 0),
                    Duration.ofMinutes(12), ALL_CRITERIA);

            var verdict = gate.review(ticket, result, OBJECTIVE);

            assertTrue(verdict.suggestions().contains(
                    "Execution took 12 minutes; consider breaking the ticket into smaller tasks"));
            assertTrue(verdict.suggestions().contains("Keep the change aligned with the objective: Add user login"));
        }
    }

    @Test
    @DisplayName("summarize aggregates verdicts")
    void summarize() {
        var verdicts = List.of(
                new ReviewVerdict("A", true, 0.9, "", List.of(), List.of(), List.of()),
                new ReviewVerdict("B", false, 0.5, "", List.of(), List.of(),
                        List.of(Ticket.builder("B-FU-1").build())));

        var summary = gate.summarize(verdicts);

        assertEquals(2, summary.totalReviews());
        assertEquals(1, summary.approved());
        assertEquals(0.5, summary.approvalRate(), 1e-9);
        assertEquals(0.7, summary.averageAlignmentScore(), 1e-9);
        assertEquals(1, summary.totalFollowUpTickets());
        assertEquals(0, gate.summarize(List.of()).totalReviews());
    }
}
