package com.fiveminds.core.graph;

import com.fiveminds.core.planner.PlanningException;

import java.util.List;

/**
 * Thrown when the ticket dependency edges contain a cycle.
 */
public class DependencyCycleException extends PlanningException {

    private final List<String> cycleTicketIds;

    public DependencyCycleException(List<String> cycleTicketIds) {
        super("Dependency cycle detected between tickets: " + String.join(" → ", cycleTicketIds));
        this.cycleTicketIds = List.copyOf(cycleTicketIds);
    }

    /**
     * Ticket ids along the cycle, the first id repeated at the end.
     */
    public List<String> cycleTicketIds() {
        return cycleTicketIds;
    }
}
