package com.fiveminds.core.model;

/**
 * A single acceptance criterion declared by a ticket.
 * <p>
 * The {@code met} flag is set only from the implementer's reported result.
 */
public final class AcceptanceCriterion {

    private final String description;
    private volatile boolean met;
    private volatile String evidence;

    public AcceptanceCriterion(String description) {
        this(description, false);
    }

    public AcceptanceCriterion(String description, boolean met) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Acceptance criterion description must not be blank");
        }
        this.description = description;
        this.met = met;
    }

    public String description() {
        return description;
    }

    public boolean isMet() {
        return met;
    }

    public String evidence() {
        return evidence;
    }

    void markMet(String evidence) {
        this.met = true;
        this.evidence = evidence;
    }

    @Override
    public String toString() {
        return (met ? "[x] " : "[ ] ") + description;
    }
}
