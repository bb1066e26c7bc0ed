package com.fiveminds.core.planner;

import com.fiveminds.core.model.Objective;
import com.fiveminds.core.model.RepositoryContext;
import com.fiveminds.core.model.Ticket;
import com.fiveminds.core.model.TicketPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based planner: one ticket per requirement, in requirement order.
 * <p>
 * Ticket ids are {@code TKT-001}, {@code TKT-002}, ... Each ticket gets three
 * acceptance criteria. A requirement that mentions setup, initialization or
 * configuration is raised to HIGH priority and every later ticket depends on it.
 */
@Component
public class HeuristicPlanner implements PlannerPort {

    private static final Logger log = LoggerFactory.getLogger(HeuristicPlanner.class);

    public static final String META_OBJECTIVE = "objective";
    public static final String META_REQUIREMENT_INDEX = "requirementIndex";

    private static final List<String> FOUNDATION_KEYWORDS = List.of("setup", "initialize", "configure");

    @Override
    public List<Ticket> plan(Objective objective, RepositoryContext repository) {
        if (objective == null || objective.description().isBlank()) {
            throw new PlanningException("Objective description must not be blank");
        }
        if (objective.requirements().isEmpty()) {
            throw new PlanningException("Objective '" + objective.description() + "' has no requirements");
        }
        log.info("Decomposing objective: {}", objective.description());

        var foundations = new ArrayList<String>();
        var tickets = new ArrayList<Ticket>();
        int index = 1;
        for (String requirement : objective.requirements()) {
            if (requirement == null || requirement.isBlank()) {
                throw new PlanningException("Requirement " + index + " of objective is blank");
            }
            String id = "TKT-%03d".formatted(index);
            boolean foundation = isFoundation(requirement);
            tickets.add(Ticket.builder(id)
                    .title(requirement)
                    .description("Implement requirement: " + requirement)
                    .criterion("Implement: " + requirement)
                    .criterion("Code passes all tests")
                    .criterion("Changes are documented")
                    .priority(foundation ? TicketPriority.HIGH : TicketPriority.MEDIUM)
                    .dependsOn(foundations)
                    .metadata(META_OBJECTIVE, objective.description())
                    .metadata(META_REQUIREMENT_INDEX, index)
                    .build());
            if (foundation) {
                foundations.add(id);
            }
            index++;
        }

        log.info("Created {} tickets from objective ({} foundation tickets, repository has {} files)",
                tickets.size(), foundations.size(), repository != null ? repository.fileCount() : 0);
        return tickets;
    }

    static boolean isFoundation(String requirement) {
        String lower = requirement.toLowerCase(Locale.ROOT);
        return FOUNDATION_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
