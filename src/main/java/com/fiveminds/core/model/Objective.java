package com.fiveminds.core.model;

import java.util.List;
import java.util.Map;

/**
 * The user's objective for a run. Source of truth for ticket generation and never
 * mutated after creation.
 *
 * @param description    what the run should accomplish
 * @param requirements   individual requirements, one ticket each by default
 * @param constraints    constraints handed to the implementer with every ticket
 * @param successMetrics how the user will judge the outcome
 * @param metadata       free-form extra data
 */
public record Objective(
    String description,
    List<String> requirements,
    List<String> constraints,
    List<String> successMetrics,
    Map<String, Object> metadata
) {

    public Objective {
        description = description != null ? description : "";
        requirements = requirements != null ? List.copyOf(requirements) : List.of();
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        successMetrics = successMetrics != null ? List.copyOf(successMetrics) : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public Objective(String description, List<String> requirements) {
        this(description, requirements, List.of(), List.of(), Map.of());
    }
}
