package com.fiveminds.core.planner;

import com.fiveminds.core.model.AcceptanceCriterion;
import com.fiveminds.core.model.Objective;
import com.fiveminds.core.model.RepositoryContext;
import com.fiveminds.core.model.TicketPriority;
import com.fiveminds.core.model.TicketStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HeuristicPlannerTest {

    private final HeuristicPlanner planner = new HeuristicPlanner();
    private final RepositoryContext repository = RepositoryContext.empty("/repo");

    @Nested
    @DisplayName("plan")
    class Plan {

        @Test
        @DisplayName("creates one PENDING ticket per requirement in order")
        void oneTicketPerRequirement() {
            var tickets = planner.plan(new Objective("Build a todo app", List.of("Add tasks", "List tasks")), repository);

            assertEquals(2, tickets.size());
            assertEquals("TKT-001", tickets.get(0).id());
            assertEquals("Add tasks", tickets.get(0).title());
            assertEquals("Implement requirement: Add tasks", tickets.get(0).description());
            assertEquals("TKT-002", tickets.get(1).id());
            assertTrue(tickets.stream().allMatch(t -> t.status() == TicketStatus.PENDING));
            assertTrue(tickets.stream().allMatch(t -> t.dependencies().isEmpty()));
            assertEquals(2, tickets.get(1).metadata().get(HeuristicPlanner.META_REQUIREMENT_INDEX));
        }

        @Test
        @DisplayName("every ticket gets three acceptance criteria")
        void criteria() {
            var ticket = planner.plan(new Objective("Build", List.of("Add tasks")), repository).get(0);

            assertEquals(List.of("Implement: Add tasks", "Code passes all tests", "Changes are documented"),
                    ticket.acceptanceCriteria().stream().map(AcceptanceCriterion::description).toList());
            assertFalse(ticket.allCriteriaMet());
        }

        @Test
        @DisplayName("later tickets depend on foundation requirements")
        void foundationDependencies() {
            var tickets = planner.plan(new Objective("Build an API",
                    List.of("Setup the project skeleton", "Add endpoints", "Configure logging", "Add docs")), repository);

            assertEquals(TicketPriority.HIGH, tickets.get(0).priority());
            assertEquals(Set.of("TKT-001"), tickets.get(1).dependencies());
            assertEquals(TicketPriority.HIGH, tickets.get(2).priority());
            assertEquals(Set.of("TKT-001"), tickets.get(2).dependencies());
            assertEquals(Set.of("TKT-001", "TKT-003"), tickets.get(3).dependencies());
            assertEquals(TicketPriority.MEDIUM, tickets.get(3).priority());
        }
    }

    @Nested
    @DisplayName("invalid objectives")
    class Invalid {

        @Test
        @DisplayName("blank description is rejected")
        void blankDescription() {
            assertThrows(PlanningException.class, () -> planner.plan(new Objective(" ", List.of("x")), repository));
        }

        @Test
        @DisplayName("no requirements is rejected")
        void noRequirements() {
            var e = assertThrows(PlanningException.class,
                    () -> planner.plan(new Objective("Build", List.of()), repository));
            assertTrue(e.getMessage().contains("no requirements"));
        }

        @Test
        @DisplayName("blank requirement is rejected")
        void blankRequirement() {
            assertThrows(PlanningException.class,
                    () -> planner.plan(new Objective("Build", Arrays.asList("Add tasks", "")), repository));
        }
    }

    @Test
    @DisplayName("foundation keywords are matched case-insensitively")
    void foundationKeywords() {
        assertTrue(HeuristicPlanner.isFoundation("Initialize the database"));
        assertTrue(HeuristicPlanner.isFoundation("SETUP CI"));
        assertFalse(HeuristicPlanner.isFoundation("Add a settings page"));
    }
}
