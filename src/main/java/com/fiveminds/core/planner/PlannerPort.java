package com.fiveminds.core.planner;

import com.fiveminds.core.model.Objective;
import com.fiveminds.core.model.RepositoryContext;
import com.fiveminds.core.model.Ticket;

import java.util.List;

/**
 * Decomposes an objective into tickets with acceptance criteria and dependencies.
 */
public interface PlannerPort {

    /**
     * @throws PlanningException if the objective cannot be decomposed
     */
    List<Ticket> plan(Objective objective, RepositoryContext repository);
}
