package com.fiveminds.core.engine;

import com.fiveminds.core.graph.TicketGraph;
import com.fiveminds.core.model.ExecutionResult;
import com.fiveminds.core.model.Objective;
import com.fiveminds.core.model.RepositoryContext;
import com.fiveminds.core.model.ReviewVerdict;
import com.fiveminds.core.model.RunPhase;
import com.fiveminds.core.model.RunStatus;
import com.fiveminds.core.model.Ticket;
import com.fiveminds.core.model.TicketOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one run, owned by the {@link Orchestrator} thread driving it.
 * Other threads only read it through {@link #snapshot()} or set the stop flag.
 */
public class RunContext {

    private final String runId;
    private final Objective objective;
    private final RunConfig config;
    private final TicketGraph graph = new TicketGraph();
    private final Instant startedAt = Instant.now();

    private final Map<String, ExecutionResult> results = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, ReviewVerdict> verdicts = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<Ticket> pendingFollowUps = new ArrayList<>();
    private final List<TicketOutcome> deferredFollowUps = new ArrayList<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private volatile RunPhase phase = RunPhase.PLANNING;
    private volatile int waveNumber;
    private volatile int generation;
    private volatile RepositoryContext repository;
    private volatile String fatalReason;

    RunContext(String runId, Objective objective, RunConfig config) {
        this.runId = runId;
        this.objective = objective;
        this.config = config;
        this.repository = RepositoryContext.empty(config.repositoryPath() != null ? config.repositoryPath().toString() : "");
    }

    public String runId() { return runId; }
    public Objective objective() { return objective; }
    public RunConfig config() { return config; }
    public TicketGraph graph() { return graph; }
    public Instant startedAt() { return startedAt; }
    public RunPhase phase() { return phase; }
    public int waveNumber() { return waveNumber; }
    public int generation() { return generation; }
    public RepositoryContext repository() { return repository; }
    public String fatalReason() { return fatalReason; }

    void phase(RunPhase next) { this.phase = next; }
    void repository(RepositoryContext context) { this.repository = context; }
    void fatalReason(String reason) { this.fatalReason = reason; }

    int nextWaveNumber() {
        return ++waveNumber;
    }

    int nextGeneration() {
        return ++generation;
    }

    public boolean stopRequested() {
        return stopRequested.get();
    }

    /**
     * @return true for the first request only
     */
    boolean requestStop() {
        return stopRequested.compareAndSet(false, true);
    }

    void recordResult(ExecutionResult result) {
        results.put(result.ticketId(), result);
    }

    void recordVerdict(ReviewVerdict verdict) {
        verdicts.put(verdict.ticketId(), verdict);
        pendingFollowUps.addAll(verdict.followUpTickets());
    }

    ExecutionResult result(String ticketId) {
        return results.get(ticketId);
    }

    ReviewVerdict verdict(String ticketId) {
        return verdicts.get(ticketId);
    }

    List<ReviewVerdict> verdicts() {
        synchronized (verdicts) {
            return List.copyOf(verdicts.values());
        }
    }

    /**
     * Returns and clears the follow-ups synthesized since the last call.
     */
    List<Ticket> drainFollowUps() {
        var drained = List.copyOf(pendingFollowUps);
        pendingFollowUps.clear();
        return drained;
    }

    void defer(TicketOutcome followUp) {
        deferredFollowUps.add(followUp);
    }

    List<TicketOutcome> deferredFollowUps() {
        return List.copyOf(deferredFollowUps);
    }

    public RunStatus snapshot() {
        return new RunStatus(runId, phase, waveNumber, generation, graph.size(), graph.statusCounts(),
                results.size(), verdicts.size());
    }
}
