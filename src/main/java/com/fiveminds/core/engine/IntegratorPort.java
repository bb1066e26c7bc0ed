package com.fiveminds.core.engine;

import com.fiveminds.core.model.ExecutionResult;
import com.fiveminds.core.model.IntegrationOutcome;

import java.util.List;

/**
 * Applies approved changes to the target repository. Invoked once per run.
 */
public interface IntegratorPort {

    /**
     * @param approved results of APPROVED tickets, in ticket creation order
     * @throws IntegrationException if the changes could not be applied
     */
    IntegrationOutcome integrate(List<ExecutionResult> approved);
}
