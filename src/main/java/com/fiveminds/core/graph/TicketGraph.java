package com.fiveminds.core.graph;

import com.fiveminds.core.model.Ticket;
import com.fiveminds.core.model.TicketStatus;
import com.fiveminds.core.planner.PlanningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Holds the tickets of one run and their dependency edges, and computes execution waves.
 *
 * <p>A PENDING ticket is eligible for the next wave when every dependency is APPROVED.
 * Eligible tickets are returned in creation order, never by priority, so two runs over
 * the same graph produce the same waves. A PENDING ticket with a dependency that ended
 * BLOCKED, FAILED, REJECTED or CANCELLED becomes BLOCKED and is never dispatched.
 *
 * <p>Follow-up tickets are the one exception: the edge to their parent is satisfied as
 * soon as the parent has been reviewed, whatever the verdict, because the follow-up
 * exists to repair that parent.
 *
 * <p>The graph is mutated only between waves; methods are synchronized so that status
 * snapshots can be read from other threads.
 */
public class TicketGraph {

    private static final Logger log = LoggerFactory.getLogger(TicketGraph.class);

    private final LinkedHashMap<String, Ticket> tickets = new LinkedHashMap<>();
    private long nextSequence = 0;

    /**
     * Adds a ticket. Dependencies may reference tickets added later; {@link #validate()}
     * checks that every reference resolves.
     *
     * @throws IllegalArgumentException if a ticket with the same id already exists
     */
    public synchronized void addTicket(Ticket ticket) {
        if (tickets.containsKey(ticket.id())) {
            throw new IllegalArgumentException("Duplicate ticket id: " + ticket.id());
        }
        ticket.assignSequence(nextSequence++);
        tickets.put(ticket.id(), ticket);
        log.debug("Added ticket {} (deps: {})", ticket.id(), ticket.dependencies());
    }

    public synchronized void addAll(Collection<Ticket> newTickets) {
        newTickets.forEach(this::addTicket);
    }

    public synchronized Ticket get(String id) {
        return tickets.get(id);
    }

    public synchronized boolean contains(String id) {
        return tickets.containsKey(id);
    }

    public synchronized int size() {
        return tickets.size();
    }

    /**
     * All tickets in creation order.
     */
    public synchronized List<Ticket> tickets() {
        return List.copyOf(tickets.values());
    }

    public synchronized Map<TicketStatus, Integer> statusCounts() {
        var counts = new EnumMap<TicketStatus, Integer>(TicketStatus.class);
        for (var ticket : tickets.values()) {
            counts.merge(ticket.status(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Returns {@code true} if the dependency edges contain at least one cycle.
     */
    public synchronized boolean cycles() {
        return !findCycle().isEmpty();
    }

    /**
     * Finds one dependency cycle, searching from tickets in creation order.
     *
     * @return the ticket ids along the cycle with the first id repeated at the end,
     *         or an empty list if the graph is acyclic
     */
    public synchronized List<String> findCycle() {
        var state = new HashMap<String, Integer>(); // 1 = on path, 2 = done
        var path = new ArrayList<String>();
        var frames = new ArrayDeque<Iterator<String>>();
        for (var root : tickets.keySet()) {
            if (state.containsKey(root)) continue;
            state.put(root, 1);
            path.add(root);
            frames.push(tickets.get(root).dependencies().iterator());
            while (!frames.isEmpty()) {
                Iterator<String> deps = frames.peek();
                if (!deps.hasNext()) {
                    frames.pop();
                    state.put(path.remove(path.size() - 1), 2);
                    continue;
                }
                var dep = deps.next();
                Integer depState = state.get(dep);
                if (depState == null) {
                    if (!tickets.containsKey(dep)) continue;
                    state.put(dep, 1);
                    path.add(dep);
                    frames.push(tickets.get(dep).dependencies().iterator());
                } else if (depState == 1) {
                    var cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                    cycle.add(dep);
                    return cycle;
                }
            }
        }
        return List.of();
    }

    /**
     * Checks that every dependency resolves and that the graph is acyclic.
     *
     * @throws PlanningException        if a dependency references an unknown ticket
     * @throws DependencyCycleException if the edges contain a cycle
     */
    public synchronized void validate() {
        for (var ticket : tickets.values()) {
            for (var dep : ticket.dependencies()) {
                if (!tickets.containsKey(dep)) {
                    throw new PlanningException(
                            "Ticket %s depends on unknown ticket %s".formatted(ticket.id(), dep));
                }
            }
        }
        var cycle = findCycle();
        if (!cycle.isEmpty()) {
            throw new DependencyCycleException(cycle);
        }
    }

    /**
     * Moves every PENDING ticket whose dependency ended in a terminal non-approved status
     * to BLOCKED, repeating until no further ticket is affected.
     *
     * @return the tickets blocked by this call, in creation order
     */
    public synchronized List<Ticket> blockUnreachable() {
        var blocked = new ArrayList<Ticket>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (var ticket : tickets.values()) {
                if (ticket.status() != TicketStatus.PENDING) continue;
                String blocker = findBlockingDependency(ticket);
                if (blocker != null) {
                    var depStatus = tickets.get(blocker).status();
                    ticket.transitionTo(TicketStatus.BLOCKED,
                            "Dependency %s is %s".formatted(blocker, depStatus));
                    log.info("Ticket {} blocked: dependency {} is {}", ticket.id(), blocker, depStatus);
                    blocked.add(ticket);
                    changed = true;
                }
            }
        }
        return blocked;
    }

    /**
     * Computes the next wave: PENDING tickets not in {@code completedIds} whose dependencies
     * are all satisfied, in creation order. Blocks unreachable tickets first.
     *
     * @param completedIds ids already dispatched or settled, excluded from the wave
     * @return eligible tickets; empty when nothing more can run
     */
    public synchronized List<Ticket> nextWave(Set<String> completedIds) {
        blockUnreachable();
        var wave = new ArrayList<Ticket>();
        for (var ticket : tickets.values()) {
            if (ticket.status() != TicketStatus.PENDING) continue;
            if (completedIds.contains(ticket.id())) continue;
            if (allDependenciesSatisfied(ticket)) {
                wave.add(ticket);
            } else {
                log.debug("  {} — deps unsatisfied: {}", ticket.id(), ticket.dependencies());
            }
        }
        log.debug("nextWave: {} tickets, {} eligible: {}", tickets.size(), wave.size(),
                wave.stream().map(Ticket::id).toList());
        return wave;
    }

    public synchronized List<Ticket> nextWave() {
        return nextWave(Set.of());
    }

    /**
     * Layers the graph into waves assuming every ticket will be approved. Does not change
     * any status. Tickets on or behind a cycle are left out.
     */
    public synchronized List<List<String>> plannedWaves() {
        var layers = new ArrayList<List<String>>();
        var placed = new HashSet<String>();
        while (placed.size() < tickets.size()) {
            var layer = new ArrayList<String>();
            for (var ticket : tickets.values()) {
                if (placed.contains(ticket.id())) continue;
                if (placed.containsAll(ticket.dependencies())) {
                    layer.add(ticket.id());
                }
            }
            if (layer.isEmpty()) {
                log.warn("Unable to layer remaining tickets, possible dependency cycle");
                break;
            }
            layers.add(List.copyOf(layer));
            placed.addAll(layer);
        }
        return layers;
    }

    private boolean allDependenciesSatisfied(Ticket ticket) {
        for (var depId : ticket.dependencies()) {
            var dep = tickets.get(depId);
            if (dep == null) return false;
            var status = dep.status();
            if (status == TicketStatus.APPROVED) continue;
            if (isParentEdge(ticket, depId) && isReviewed(status)) continue;
            return false;
        }
        return true;
    }

    private String findBlockingDependency(Ticket ticket) {
        for (var depId : ticket.dependencies()) {
            var dep = tickets.get(depId);
            if (dep == null || !dep.status().isTerminalFailure()) continue;
            if (isParentEdge(ticket, depId) && isReviewed(dep.status())) continue;
            return depId;
        }
        return null;
    }

    private static boolean isParentEdge(Ticket ticket, String depId) {
        return ticket.isFollowUp() && depId.equals(ticket.parentTicketId());
    }

    private static boolean isReviewed(TicketStatus status) {
        return status == TicketStatus.APPROVED || status == TicketStatus.REJECTED || status == TicketStatus.FAILED;
    }
}
