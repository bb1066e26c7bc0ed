package com.fiveminds.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A single unit of work, executed by the implementer inside its own sandbox.
 * <p>
 * Everything except status, status reason, assigned runner and the criteria's
 * {@code met} flags is fixed at creation. Status changes go through
 * {@link #transitionTo} which enforces the {@link TicketStatus} state machine.
 * Tickets are never deleted, only moved to a terminal status.
 */
public final class Ticket {

    public static final String META_FOLLOW_UP = "followUp";
    public static final String META_PARENT_TICKET_ID = "parentTicketId";
    public static final String META_GENERATION = "generation";

    private final String id;
    private final String title;
    private final String description;
    private final List<AcceptanceCriterion> acceptanceCriteria;
    private final TicketPriority priority;
    private final Set<String> dependencies;
    private final Map<String, Object> metadata;

    private TicketStatus status = TicketStatus.PENDING;
    private String statusReason = "Created";
    private long sequence = -1;
    private volatile String assignedRunner;

    private Ticket(Builder builder) {
        if (builder.id == null || builder.id.isBlank()) {
            throw new IllegalArgumentException("Ticket id must not be blank");
        }
        this.id = builder.id;
        this.title = builder.title != null ? builder.title : builder.id;
        this.description = builder.description != null ? builder.description : "";
        this.acceptanceCriteria = List.copyOf(builder.criteria);
        this.priority = builder.priority != null ? builder.priority : TicketPriority.MEDIUM;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dependencies));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() { return id; }
    public String title() { return title; }
    public String description() { return description; }
    public List<AcceptanceCriterion> acceptanceCriteria() { return acceptanceCriteria; }
    public TicketPriority priority() { return priority; }
    public Set<String> dependencies() { return dependencies; }
    public Map<String, Object> metadata() { return metadata; }
    public String assignedRunner() { return assignedRunner; }

    public synchronized TicketStatus status() {
        return status;
    }

    public synchronized String statusReason() {
        return statusReason;
    }

    /**
     * Creation order within the owning graph, or -1 if the ticket was never added to one.
     */
    public synchronized long sequence() {
        return sequence;
    }

    public synchronized void assignSequence(long value) {
        if (sequence >= 0) {
            throw new IllegalStateException("Ticket " + id + " already belongs to a graph");
        }
        sequence = value;
    }

    public boolean isFollowUp() {
        return Boolean.TRUE.equals(metadata.get(META_FOLLOW_UP));
    }

    /**
     * Id of the ticket whose review spawned this one, or {@code null}.
     */
    public String parentTicketId() {
        Object parent = metadata.get(META_PARENT_TICKET_ID);
        return parent != null ? parent.toString() : null;
    }

    public int generation() {
        Object generation = metadata.get(META_GENERATION);
        return generation instanceof Number n ? n.intValue() : 0;
    }

    public void assignRunner(String runnerId) {
        this.assignedRunner = runnerId;
    }

    /**
     * Moves the ticket to {@code next}.
     *
     * @return the previous status
     * @throws IllegalStateException if the state machine does not allow the transition
     */
    public synchronized TicketStatus transitionTo(TicketStatus next, String reason) {
        Objects.requireNonNull(next, "next status");
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Invalid status transition for ticket %s: %s → %s".formatted(id, status, next));
        }
        TicketStatus previous = status;
        status = next;
        statusReason = reason != null ? reason : next.name();
        return previous;
    }

    /**
     * Marks the criteria whose descriptions the implementer reported as met.
     *
     * @return number of criteria newly marked
     */
    public int applyCriteriaReport(Set<String> metDescriptions, String evidence) {
        if (metDescriptions == null || metDescriptions.isEmpty()) return 0;
        int marked = 0;
        for (var criterion : acceptanceCriteria) {
            if (!criterion.isMet() && metDescriptions.contains(criterion.description())) {
                criterion.markMet(evidence);
                marked++;
            }
        }
        return marked;
    }

    public long criteriaMetCount() {
        return acceptanceCriteria.stream().filter(AcceptanceCriterion::isMet).count();
    }

    public boolean allCriteriaMet() {
        return acceptanceCriteria.stream().allMatch(AcceptanceCriterion::isMet);
    }

    public List<AcceptanceCriterion> unmetCriteria() {
        return acceptanceCriteria.stream().filter(c -> !c.isMet()).toList();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Ticket other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Ticket[" + id + ", " + status() + "]";
    }

    public static final class Builder {
        private final String id;
        private String title;
        private String description;
        private final List<AcceptanceCriterion> criteria = new ArrayList<>();
        private TicketPriority priority = TicketPriority.MEDIUM;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder priority(TicketPriority priority) { this.priority = priority; return this; }

        public Builder criterion(String description) {
            criteria.add(new AcceptanceCriterion(description));
            return this;
        }

        public Builder criteria(List<String> descriptions) {
            descriptions.forEach(this::criterion);
            return this;
        }

        public Builder dependsOn(String... ids) {
            Collections.addAll(dependencies, ids);
            return this;
        }

        public Builder dependsOn(Iterable<String> ids) {
            ids.forEach(dependencies::add);
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public Builder followUpOf(Ticket parent) {
            dependencies.add(parent.id());
            metadata.put(META_FOLLOW_UP, true);
            metadata.put(META_PARENT_TICKET_ID, parent.id());
            metadata.put(META_GENERATION, parent.generation() + 1);
            return this;
        }

        public Ticket build() {
            return new Ticket(this);
        }
    }
}
