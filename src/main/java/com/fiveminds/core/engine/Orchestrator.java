package com.fiveminds.core.engine;

import com.fiveminds.core.events.EventBus;
import com.fiveminds.core.events.FiveMindsEvent;
import com.fiveminds.core.execution.ExecutionCoordinator;
import com.fiveminds.core.execution.ImplementerPort;
import com.fiveminds.core.execution.WaveContext;
import com.fiveminds.core.logging.MdcContext;
import com.fiveminds.core.metrics.FiveMindsMetrics;
import com.fiveminds.core.model.ExecutionResult;
import com.fiveminds.core.model.FinalTestOutcome;
import com.fiveminds.core.model.IntegrationOutcome;
import com.fiveminds.core.model.Objective;
import com.fiveminds.core.model.ReviewSummary;
import com.fiveminds.core.model.ReviewVerdict;
import com.fiveminds.core.model.RunPhase;
import com.fiveminds.core.model.RunReport;
import com.fiveminds.core.model.RunStatus;
import com.fiveminds.core.model.Ticket;
import com.fiveminds.core.model.TicketOutcome;
import com.fiveminds.core.model.TicketStatus;
import com.fiveminds.core.planner.PlannerPort;
import com.fiveminds.core.planner.PlanningException;
import com.fiveminds.core.review.ReviewerPort;
import com.fiveminds.core.scanner.RepositoryScanner;
import com.fiveminds.sandbox.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a run through its phases: PLANNING, then EXECUTING and REVIEWING once per
 * wave, then INTEGRATING, ending COMPLETED or FAILED.
 * <p>
 * Each wave's results are reviewed before the next wave is computed, so approvals
 * unlock dependents. When no ticket is eligible the generation ends; the follow-ups it
 * produced start the next generation while the follow-up depth allows, and are
 * reported as deferred otherwise. A report is produced for every run, including runs
 * that fail during planning.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final PlannerPort planner;
    private final RepositoryScanner scanner;
    private final ExecutionCoordinator coordinator;
    private final ReviewerPort reviewer;
    private final ImplementerPort implementer;
    private final IntegratorPort integrator;
    private final FinalTestPort finalTests;
    private final EventBus eventBus;
    private final FiveMindsMetrics metrics;
    private final SandboxProperties sandboxProperties;
    private final RunProperties runProperties;

    private final Map<String, RunContext> activeRuns = new ConcurrentHashMap<>();

    public Orchestrator(PlannerPort planner, RepositoryScanner scanner, ExecutionCoordinator coordinator,
                        ReviewerPort reviewer, ImplementerPort implementer, IntegratorPort integrator,
                        FinalTestPort finalTests, EventBus eventBus, FiveMindsMetrics metrics,
                        SandboxProperties sandboxProperties, RunProperties runProperties) {
        this.planner = planner;
        this.scanner = scanner;
        this.coordinator = coordinator;
        this.reviewer = reviewer;
        this.implementer = implementer;
        this.integrator = integrator;
        this.finalTests = finalTests;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.sandboxProperties = sandboxProperties;
        this.runProperties = runProperties;
    }

    /**
     * Runs the objective with the configured defaults.
     */
    public RunReport run(Objective objective) {
        return run(objective, defaultConfig());
    }

    public RunReport run(Objective objective, RunConfig config) {
        return run(generateRunId(), objective, config, implementer);
    }

    public RunReport run(Objective objective, RunConfig config, ImplementerPort implementer) {
        return run(generateRunId(), objective, config, implementer);
    }

    /**
     * Runs an objective to completion on the calling thread.
     *
     * @param runId       unique id for events, logging and the report
     * @param implementer implementer used for every ticket of this run
     * @return the final report; never {@code null}
     * @throws IllegalArgumentException if a run with the same id is already active
     */
    public RunReport run(String runId, Objective objective, RunConfig config, ImplementerPort implementer) {
        var context = new RunContext(runId, objective, config);
        if (activeRuns.putIfAbsent(runId, context) != null) {
            throw new IllegalArgumentException("Run " + runId + " is already active");
        }
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {}: {} ({} requirements, maxRunners={}, threshold={}, maxFollowUpDepth={})",
                    runId, objective.description(), objective.requirements().size(),
                    config.maxRunners(), config.approvalThreshold(), config.maxFollowUpDepth());

            if (!plan(context)) {
                return finish(context, RunPhase.FAILED, null, null);
            }
            try {
                executeGenerations(context, implementer);
                enterPhase(context, RunPhase.INTEGRATING);
                IntegrationOutcome integration = integrate(context);
                FinalTestOutcome tests = runFinalTests(context);
                return finish(context, RunPhase.COMPLETED, integration, tests);
            } catch (RuntimeException e) {
                log.error("Run {} failed during {}", runId, context.phase(), e);
                context.fatalReason("Failed during " + context.phase() + ": " + describe(e));
                return finish(context, RunPhase.FAILED, null, null);
            }
        } finally {
            activeRuns.remove(runId);
            MdcContext.clear();
        }
    }

    /**
     * Requests a stop: no further wave starts and the tickets of the current wave that
     * have no result yet are cancelled. The run then integrates what was approved.
     *
     * @return false if no such run is active
     */
    public boolean stop(String runId) {
        RunContext context = activeRuns.get(runId);
        if (context == null) {
            return false;
        }
        if (context.requestStop()) {
            int cancelled = coordinator.cancelRun(runId);
            log.info("Stop requested for run {} in phase {}, {} tickets cancelled", runId, context.phase(), cancelled);
        }
        return true;
    }

    public Optional<RunStatus> status(String runId) {
        return Optional.ofNullable(activeRuns.get(runId)).map(RunContext::snapshot);
    }

    public RunConfig defaultConfig() {
        return RunConfig.from(sandboxProperties, runProperties);
    }

    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("FM-%d-%04d", year, count);
    }

    // -- PLANNING --

    private boolean plan(RunContext context) {
        enterPhase(context, RunPhase.PLANNING);
        long start = System.currentTimeMillis();
        try {
            var repoPath = context.config().repositoryPath();
            if (repoPath != null) {
                try {
                    context.repository(scanner.scan(repoPath));
                } catch (IOException e) {
                    throw new PlanningException("Failed to scan repository " + repoPath + ": " + e.getMessage(), e);
                }
            }

            List<Ticket> tickets = planner.plan(context.objective(), context.repository());
            if (tickets == null || tickets.isEmpty()) {
                throw new PlanningException("Planner produced no tickets");
            }
            try {
                context.graph().addAll(tickets);
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new PlanningException(e.getMessage(), e);
            }
            context.graph().validate();

            for (Ticket ticket : context.graph().tickets()) {
                publishTicketCreated(context, ticket);
            }
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordPlanningDuration(elapsed);
            log.info("Planned {} tickets in {}ms, expected waves: {}", context.graph().size(), elapsed,
                    context.graph().plannedWaves());
            return true;
        } catch (PlanningException e) {
            log.error("Planning failed for run {}: {}", context.runId(), e.getMessage());
            context.fatalReason(e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Planner failed for run {}", context.runId(), e);
            context.fatalReason("Planner failed: " + describe(e));
            return false;
        }
    }

    // -- EXECUTING / REVIEWING --

    private void executeGenerations(RunContext context, ImplementerPort implementer) {
        while (true) {
            int generation = context.nextGeneration();
            log.info("Starting generation {} of run {}", generation, context.runId());
            runGeneration(context, implementer);

            List<Ticket> followUps = context.drainFollowUps();
            if (context.stopRequested()) {
                followUps.forEach(t -> context.defer(deferred(t, "Run was stopped")));
                return;
            }
            if (followUps.isEmpty()) {
                return;
            }
            // generation N produced follow-ups of depth N
            if (generation > context.config().maxFollowUpDepth()) {
                log.info("Deferring {} follow-ups: follow-up depth limit {} reached",
                        followUps.size(), context.config().maxFollowUpDepth());
                followUps.forEach(t -> context.defer(
                        deferred(t, "Follow-up depth limit " + context.config().maxFollowUpDepth() + " reached")));
                return;
            }
            insertFollowUps(context, followUps);
        }
    }

    private void runGeneration(RunContext context, ImplementerPort implementer) {
        var graph = context.graph();
        while (!context.stopRequested()) {
            for (Ticket blocked : graph.blockUnreachable()) {
                eventBus.publish(FiveMindsEvent.ticketStatus(context.runId(), blocked, TicketStatus.PENDING));
            }
            List<Ticket> wave = graph.nextWave();
            if (wave.isEmpty()) {
                return;
            }
            int waveNumber = context.nextWaveNumber();
            var ids = wave.stream().map(Ticket::id).toList();
            MdcContext.setWave(context.runId(), waveNumber);

            enterPhase(context, RunPhase.EXECUTING);
            eventBus.publish(FiveMindsEvent.of(FiveMindsEvent.WAVE_STARTED, context.runId(), "wave-" + waveNumber,
                    Map.of("wave", waveNumber, "generation", context.generation(), "tickets", ids)));

            // workers re-check the stop flag, so a stop landing before dispatch still cancels this wave
            var waveContext = new WaveContext(context.runId(), waveNumber, context.config().repositoryPath(),
                    context.objective().constraints(), context.config().ticketTimeout(), context::stopRequested);
            Map<String, ExecutionResult> results =
                    coordinator.runWave(waveContext, wave, implementer, context.config().maxRunners());
            results.values().forEach(context::recordResult);
            long succeeded = results.values().stream().filter(ExecutionResult::success).count();
            eventBus.publish(FiveMindsEvent.of(FiveMindsEvent.WAVE_COMPLETED, context.runId(), "wave-" + waveNumber,
                    Map.of("wave", waveNumber, "succeeded", succeeded, "failed", results.size() - succeeded)));

            enterPhase(context, RunPhase.REVIEWING);
            for (Ticket ticket : wave) {
                review(context, ticket, results.get(ticket.id()));
            }
        }
        log.info("Run {} stopped; no further waves will start", context.runId());
    }

    private void review(RunContext context, Ticket ticket, ExecutionResult result) {
        if (result == null || ticket.status() == TicketStatus.CANCELLED) {
            log.info("Skipping review of ticket {}: {}", ticket.id(), ticket.statusReason());
            return;
        }
        ReviewVerdict verdict = reviewer.review(ticket, result, context.objective(), context.config().approvalThreshold());
        context.recordVerdict(verdict);

        if (ticket.status() == TicketStatus.NEEDS_REVIEW) {
            var next = verdict.approved() ? TicketStatus.APPROVED : TicketStatus.REJECTED;
            String reason = String.format(Locale.ROOT, "%s with alignment %.2f",
                    verdict.approved() ? "Approved" : "Rejected", verdict.alignmentScore());
            TicketStatus previous = ticket.transitionTo(next, reason);
            eventBus.publish(FiveMindsEvent.ticketStatus(context.runId(), ticket, previous));
        }

        metrics.recordReviewVerdict(verdict.approved(), verdict.alignmentScore());
        if (!verdict.followUpTickets().isEmpty()) {
            metrics.recordFollowUps(verdict.followUpTickets().size());
        }
        eventBus.publish(FiveMindsEvent.of(FiveMindsEvent.REVIEW_VERDICT, context.runId(), ticket.id(),
                Map.of("approved", verdict.approved(),
                       "alignmentScore", verdict.alignmentScore(),
                       "followUps", verdict.followUpTickets().stream().map(Ticket::id).toList(),
                       "riskFindings", verdict.riskFindings())));
    }

    private void insertFollowUps(RunContext context, List<Ticket> followUps) {
        var graph = context.graph();
        var inserted = new ArrayList<Ticket>();
        for (Ticket followUp : followUps) {
            if (graph.contains(followUp.id())) {
                log.warn("Follow-up {} already exists, skipping", followUp.id());
                continue;
            }
            graph.addTicket(followUp);
            inserted.add(followUp);
        }
        graph.validate();
        inserted.forEach(t -> publishTicketCreated(context, t));
        log.info("Inserted {} follow-up tickets for generation {}", inserted.size(), context.generation() + 1);
    }

    // -- INTEGRATING --

    private IntegrationOutcome integrate(RunContext context) {
        var approved = new ArrayList<ExecutionResult>();
        for (Ticket ticket : context.graph().tickets()) {
            if (ticket.status() == TicketStatus.APPROVED) {
                approved.add(context.result(ticket.id()));
            }
        }
        log.info("Integrating {} approved results", approved.size());
        try {
            IntegrationOutcome outcome = integrator.integrate(approved);
            if (!outcome.success()) {
                log.warn("Integration reported failure: {}", outcome.log());
            }
            return outcome;
        } catch (IntegrationException e) {
            log.warn("Integration failed: {}", e.getMessage());
            return IntegrationOutcome.failed(approved.size(), e.getMessage());
        }
    }

    private FinalTestOutcome runFinalTests(RunContext context) {
        var repoPath = context.config().repositoryPath();
        if (repoPath == null) {
            return FinalTestOutcome.notRun("No repository configured");
        }
        FinalTestOutcome outcome = finalTests.run(repoPath);
        log.info("Final tests {}: {}", outcome.passed() ? "passed" : "did not pass", outcome.summary());
        return outcome;
    }

    // -- REPORT --

    private RunReport finish(RunContext context, RunPhase finalPhase,
                             IntegrationOutcome integration, FinalTestOutcome tests) {
        RunPhase reachedPhase = context.phase();
        enterPhase(context, finalPhase);

        var outcomes = new ArrayList<TicketOutcome>();
        var counts = new LinkedHashMap<TicketStatus, Integer>();
        // a graph rejected during planning is not reported; nothing of it was executed
        List<Ticket> reported = reachedPhase == RunPhase.PLANNING && finalPhase == RunPhase.FAILED
                ? List.of()
                : context.graph().tickets();
        for (Ticket ticket : reported) {
            TicketStatus status = ticket.status();
            counts.merge(status, 1, Integer::sum);
            String reason = status.isTerminal()
                    ? ticket.statusReason()
                    : "Not finished: left " + status + " when the run ended in " + reachedPhase;
            ReviewVerdict verdict = context.verdict(ticket.id());
            outcomes.add(new TicketOutcome(ticket.id(), ticket.title(), status, reason,
                    verdict != null ? verdict.alignmentScore() : null, ticket.isFollowUp()));
        }

        List<ReviewVerdict> verdicts = context.verdicts();
        ReviewSummary summary = ReviewSummary.of(verdicts);
        String notReached = finalPhase == RunPhase.FAILED
                ? "Run failed before integration"
                : "Integration not reached";

        var report = new RunReport(
                context.runId(),
                context.objective().description(),
                finalPhase,
                context.fatalReason(),
                outcomes,
                counts,
                summary,
                summary.averageAlignmentScore(),
                integration != null ? integration : IntegrationOutcome.skipped(notReached),
                tests != null ? tests : FinalTestOutcome.notRun(notReached),
                context.deferredFollowUps(),
                context.waveNumber(),
                context.generation(),
                context.repository(),
                context.startedAt(),
                Instant.now());

        metrics.recordRunResult(finalPhase.name());
        metrics.recordGenerationDepth(context.generation());
        log.info("Run {} {}: {} tickets {}, {} waves, {} generations, aggregate alignment {}",
                context.runId(), finalPhase, outcomes.size(), counts, context.waveNumber(),
                context.generation(), String.format(Locale.ROOT, "%.2f", report.aggregateAlignment()));
        return report;
    }

    private void enterPhase(RunContext context, RunPhase phase) {
        RunPhase previous = context.phase();
        context.phase(phase);
        if (previous != phase || phase == RunPhase.PLANNING) {
            log.debug("Run {} phase {} → {}", context.runId(), previous, phase);
            eventBus.publish(FiveMindsEvent.of(FiveMindsEvent.RUN_PHASE, context.runId(), null,
                    Map.of("phase", phase.name(), "previous", previous.name())));
        }
    }

    private void publishTicketCreated(RunContext context, Ticket ticket) {
        eventBus.publish(FiveMindsEvent.of(FiveMindsEvent.TICKET_CREATED, context.runId(), ticket.id(),
                Map.of("title", ticket.title(),
                       "priority", ticket.priority().name(),
                       "dependencies", List.copyOf(ticket.dependencies()),
                       "followUp", ticket.isFollowUp())));
    }

    private TicketOutcome deferred(Ticket ticket, String reason) {
        return new TicketOutcome(ticket.id(), ticket.title(), ticket.status(), "Deferred: " + reason, null, true);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
