package com.fiveminds.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TicketTest {

    private Ticket ticket(String id) {
        return Ticket.builder(id)
                .title("Ticket " + id)
                .criterion("Implement: login")
                .criterion("Code passes all tests")
                .build();
    }

    @Nested
    @DisplayName("status machine")
    class StatusMachine {

        @Test
        @DisplayName("new tickets start PENDING")
        void startsPending() {
            assertEquals(TicketStatus.PENDING, ticket("A").status());
        }

        @Test
        @DisplayName("happy path PENDING → IN_PROGRESS → NEEDS_REVIEW → APPROVED")
        void happyPath() {
            var t = ticket("A");
            assertEquals(TicketStatus.PENDING, t.transitionTo(TicketStatus.IN_PROGRESS, "picked up"));
            assertEquals(TicketStatus.IN_PROGRESS, t.transitionTo(TicketStatus.NEEDS_REVIEW, "done"));
            t.transitionTo(TicketStatus.APPROVED, "good");
            assertEquals(TicketStatus.APPROVED, t.status());
            assertEquals("good", t.statusReason());
        }

        @Test
        @DisplayName("rejects skipping IN_PROGRESS")
        void rejectsPendingToNeedsReview() {
            var t = ticket("A");
            var ex = assertThrows(IllegalStateException.class,
                    () -> t.transitionTo(TicketStatus.NEEDS_REVIEW, "skip"));
            assertTrue(ex.getMessage().contains("PENDING"));
            assertEquals(TicketStatus.PENDING, t.status());
        }

        @Test
        @DisplayName("terminal statuses allow no further transition")
        void terminalIsFinal() {
            for (var status : TicketStatus.values()) {
                if (status.isTerminal()) {
                    assertTrue(status.allowedNext().isEmpty(), status + " should be final");
                }
            }
            var t = ticket("A");
            t.transitionTo(TicketStatus.BLOCKED, "dep failed");
            assertThrows(IllegalStateException.class, () -> t.transitionTo(TicketStatus.IN_PROGRESS, "retry"));
        }

        @Test
        @DisplayName("APPROVED is the only terminal status that is not a failure")
        void terminalFailure() {
            assertFalse(TicketStatus.APPROVED.isTerminalFailure());
            assertTrue(TicketStatus.REJECTED.isTerminalFailure());
            assertTrue(TicketStatus.BLOCKED.isTerminalFailure());
            assertTrue(TicketStatus.CANCELLED.isTerminalFailure());
            assertTrue(TicketStatus.FAILED.isTerminalFailure());
            assertFalse(TicketStatus.NEEDS_REVIEW.isTerminalFailure());
        }
    }

    @Nested
    @DisplayName("acceptance criteria")
    class Criteria {

        @Test
        @DisplayName("marks only the criteria named in the report")
        void appliesReport() {
            var t = ticket("A");
            int marked = t.applyCriteriaReport(Set.of("Implement: login", "Unknown criterion"), "diff");
            assertEquals(1, marked);
            assertEquals(1, t.criteriaMetCount());
            assertFalse(t.allCriteriaMet());
            assertEquals("Code passes all tests", t.unmetCriteria().get(0).description());
            assertEquals("diff", t.acceptanceCriteria().get(0).evidence());
        }

        @Test
        @DisplayName("a ticket without criteria has all criteria met")
        void noCriteria() {
            assertTrue(Ticket.builder("X").build().allCriteriaMet());
        }
    }

    @Nested
    @DisplayName("builder")
    class BuilderTests {

        @Test
        @DisplayName("followUpOf links parent and increments generation")
        void followUpOf() {
            var parent = ticket("A");
            var child = Ticket.builder("A-FU-1").followUpOf(parent).build();
            var grandChild = Ticket.builder("A-FU-1-FU-1").followUpOf(child).build();

            assertTrue(child.isFollowUp());
            assertEquals("A", child.parentTicketId());
            assertTrue(child.dependencies().contains("A"));
            assertEquals(1, child.generation());
            assertEquals(2, grandChild.generation());
            assertFalse(parent.isFollowUp());
            assertEquals(0, parent.generation());
        }

        @Test
        @DisplayName("blank ids are rejected")
        void blankId() {
            assertThrows(IllegalArgumentException.class, () -> Ticket.builder(" ").build());
        }

        @Test
        @DisplayName("defaults title to id and priority to MEDIUM")
        void defaults() {
            var t = Ticket.builder("Z").build();
            assertEquals("Z", t.title());
            assertEquals(TicketPriority.MEDIUM, t.priority());
            assertEquals(-1, t.sequence());
        }
    }
}
