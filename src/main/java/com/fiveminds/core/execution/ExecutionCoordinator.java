package com.fiveminds.core.execution;

import com.fiveminds.core.FiveMindsException;
import com.fiveminds.core.events.EventBus;
import com.fiveminds.core.events.FiveMindsEvent;
import com.fiveminds.core.logging.MdcContext;
import com.fiveminds.core.metrics.FiveMindsMetrics;
import com.fiveminds.core.model.ExecutionErrorKind;
import com.fiveminds.core.model.ExecutionResult;
import com.fiveminds.core.model.LogEntry;
import com.fiveminds.core.model.Ticket;
import com.fiveminds.core.model.TicketStatus;
import com.fiveminds.sandbox.Sandbox;
import com.fiveminds.sandbox.SandboxAcquisitionException;
import com.fiveminds.sandbox.SandboxLifecycle;
import com.fiveminds.sandbox.SandboxProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatches one wave of tickets onto a bounded worker pool and waits for all of them.
 *
 * <p>Each worker moves its ticket to IN_PROGRESS, acquires a sandbox in a
 * try-with-resources scope, invokes the implementer on a separate interruptible
 * thread with the configured timeout, and records the result and the resulting
 * status (NEEDS_REVIEW, FAILED or CANCELLED). {@link #runWave} returns only when
 * every ticket of the wave has a result.
 */
@Service
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final SandboxLifecycle sandboxes;
    private final EventBus eventBus;
    private final FiveMindsMetrics metrics;
    private final Duration defaultTimeout;
    private final ExecutorService invocations;

    /** Invocation futures of tickets currently inside the implementer. */
    private final Map<TicketKey, Future<ExecutionResult>> inFlight = new ConcurrentHashMap<>();
    /** Tickets of running waves that have not produced a result yet. */
    private final Set<TicketKey> pending = ConcurrentHashMap.newKeySet();
    private final Set<TicketKey> cancelRequested = ConcurrentHashMap.newKeySet();

    /** Ticket ids are unique within a run only; concurrent runs may reuse them. */
    private record TicketKey(String runId, String ticketId) {}

    @Autowired
    public ExecutionCoordinator(SandboxLifecycle sandboxes, EventBus eventBus, FiveMindsMetrics metrics,
                                SandboxProperties properties) {
        this(sandboxes, eventBus, metrics, properties.getTimeout());
    }

    public ExecutionCoordinator(SandboxLifecycle sandboxes, EventBus eventBus, FiveMindsMetrics metrics,
                                Duration defaultTimeout) {
        this.sandboxes = sandboxes;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.defaultTimeout = defaultTimeout;
        this.invocations = Executors.newCachedThreadPool(namedDaemon("fiveminds-implementer-"));
    }

    /**
     * Runs a wave with the default timeout, no base snapshot and a generated run id.
     */
    public Map<String, ExecutionResult> runWave(List<Ticket> tickets, ImplementerPort implementer, int poolSize) {
        return runWave(new WaveContext("adhoc", 1, null, List.of(), defaultTimeout), tickets, implementer, poolSize);
    }

    /**
     * Executes every ticket of the wave with at most {@code poolSize} running at once.
     *
     * @param tickets PENDING tickets with distinct ids
     * @return one result per ticket, in wave order
     * @throws IllegalArgumentException if {@code poolSize < 1}, ids repeat or a ticket is not PENDING
     */
    public Map<String, ExecutionResult> runWave(WaveContext context, List<Ticket> tickets,
                                                ImplementerPort implementer, int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1, got " + poolSize);
        }
        var ids = new HashSet<String>();
        for (Ticket ticket : tickets) {
            if (!ids.add(ticket.id())) {
                throw new IllegalArgumentException("Ticket " + ticket.id() + " appears twice in the wave");
            }
            if (ticket.status() != TicketStatus.PENDING) {
                throw new IllegalArgumentException(
                        "Ticket " + ticket.id() + " is " + ticket.status() + ", only PENDING tickets can be dispatched");
            }
        }
        if (tickets.isEmpty()) {
            return Map.of();
        }

        int workers = Math.min(poolSize, tickets.size());
        log.info("Dispatching wave {} with {} tickets on {} workers", context.waveNumber(), tickets.size(), workers);
        metrics.recordWaveExecution(tickets.size(), poolSize);

        for (String id : ids) {
            pending.add(new TicketKey(context.runId(), id));
        }
        var results = new ConcurrentHashMap<String, ExecutionResult>();
        var barrier = new CountDownLatch(tickets.size());
        var mdc = MdcContext.capture();
        ExecutorService pool = Executors.newFixedThreadPool(workers, namedDaemon("fiveminds-wave-" + context.waveNumber() + "-"));
        try {
            for (Ticket ticket : tickets) {
                pool.execute(() -> {
                    MdcContext.restore(mdc);
                    MdcContext.setTicket(context.runId(), ticket.id());
                    try {
                        results.put(ticket.id(), executeTicket(context, ticket, implementer));
                    } catch (RuntimeException e) {
                        log.error("Worker failed on ticket {} outside execution", ticket.id(), e);
                        results.put(ticket.id(), ExecutionResult.failure(ticket.id(),
                                ExecutionErrorKind.EXECUTION_FAILURE, describe(e), List.of(), Duration.ZERO));
                    } finally {
                        var key = new TicketKey(context.runId(), ticket.id());
                        pending.remove(key);
                        cancelRequested.remove(key);
                        barrier.countDown();
                        MdcContext.clear();
                    }
                });
            }
            awaitBarrier(barrier, context.runId(), ids);
        } finally {
            pool.shutdownNow();
        }

        var ordered = new LinkedHashMap<String, ExecutionResult>();
        for (Ticket ticket : tickets) {
            ordered.put(ticket.id(), results.get(ticket.id()));
        }
        log.info("Wave {} finished: {} succeeded, {} failed", context.waveNumber(),
                ordered.values().stream().filter(ExecutionResult::success).count(),
                ordered.values().stream().filter(r -> !r.success()).count());
        return Collections.unmodifiableMap(ordered);
    }

    /**
     * Requests cancellation of one ticket of one run. A ticket still queued is cancelled
     * when a worker picks it up; a running one has its invocation interrupted. Siblings
     * and tickets of other runs are unaffected.
     *
     * @return true if the ticket belongs to a running wave and has no result yet
     */
    public boolean cancel(String runId, String ticketId) {
        return cancel(new TicketKey(runId, ticketId));
    }

    /**
     * Cancels every pending ticket of one run.
     *
     * @return number of tickets a cancellation was issued for
     */
    public int cancelRun(String runId) {
        int count = 0;
        for (TicketKey key : new ArrayList<>(pending)) {
            if (key.runId().equals(runId) && cancel(key)) count++;
        }
        return count;
    }

    /**
     * Cancels every ticket of every running wave.
     *
     * @return number of tickets a cancellation was issued for
     */
    public int cancelAll() {
        int count = 0;
        for (TicketKey key : new ArrayList<>(pending)) {
            if (cancel(key)) count++;
        }
        return count;
    }

    private boolean cancel(TicketKey key) {
        if (!pending.contains(key)) {
            return false;
        }
        cancelRequested.add(key);
        Future<ExecutionResult> future = inFlight.get(key);
        if (future != null) {
            future.cancel(true);
        }
        log.info("Cancellation requested for ticket {} of run {}", key.ticketId(), key.runId());
        return true;
    }

    @PreDestroy
    public void shutdown() {
        invocations.shutdownNow();
    }

    private ExecutionResult executeTicket(WaveContext context, Ticket ticket, ImplementerPort implementer) {
        Instant start = Instant.now();
        transition(context, ticket, TicketStatus.IN_PROGRESS, "Picked up by worker " + Thread.currentThread().getName());

        ExecutionResult result;
        if (cancellationRequested(context, ticket)) {
            result = ExecutionResult.failure(ticket.id(), ExecutionErrorKind.CANCELLED,
                    "Cancelled before execution started", List.of(), Duration.ZERO);
        } else {
            try (Sandbox sandbox = sandboxes.acquire(ticket.id(), context.baseSnapshot())) {
                ticket.assignRunner(sandbox.id());
                result = invoke(context, ticket, sandbox, implementer);
            } catch (SandboxAcquisitionException e) {
                log.warn("Could not acquire sandbox for ticket {}: {}", ticket.id(), e.getMessage());
                result = ExecutionResult.failure(ticket.id(), ExecutionErrorKind.SANDBOX_ACQUISITION_FAILURE,
                        e.getMessage(), List.of(), Duration.ZERO);
            } catch (RuntimeException e) {
                log.error("Unexpected error executing ticket {}", ticket.id(), e);
                result = ExecutionResult.failure(ticket.id(), ExecutionErrorKind.EXECUTION_FAILURE,
                        describe(e), List.of(), Duration.ZERO);
            }
        }
        Duration elapsed = Duration.between(start, Instant.now());
        result = result.withDuration(elapsed);

        if (result.success()) {
            ticket.applyCriteriaReport(result.metCriteria(), "Reported by implementer for " + ticket.id());
            transition(context, ticket, TicketStatus.NEEDS_REVIEW, "Execution succeeded");
        } else if (result.cancelled()) {
            transition(context, ticket, TicketStatus.CANCELLED, result.errorMessage());
        } else {
            transition(context, ticket, TicketStatus.FAILED, result.errorKind() + ": " + result.errorMessage());
        }
        metrics.recordTicketExecution(outcomeTag(result), elapsed);
        return result;
    }

    private ExecutionResult invoke(WaveContext context, Ticket ticket, Sandbox sandbox, ImplementerPort implementer) {
        List<LogEntry> streamed = Collections.synchronizedList(new ArrayList<>());
        var request = new ImplementationRequest(ticket, sandbox.workspace(), context.constraints(), line -> {
            streamed.add(LogEntry.now(line));
            eventBus.publish(FiveMindsEvent.of(FiveMindsEvent.EXECUTION_LOG, context.runId(), ticket.id(),
                    Map.of("line", line, "sandboxId", sandbox.id())));
        });

        var mdc = MdcContext.capture();
        Future<ExecutionResult> future = invocations.submit(() -> {
            MdcContext.restore(mdc);
            try {
                return implementer.implement(request);
            } finally {
                MdcContext.clear();
            }
        });
        var key = new TicketKey(context.runId(), ticket.id());
        inFlight.put(key, future);
        if (cancellationRequested(context, ticket)) {
            future.cancel(true);
        }

        try {
            ExecutionResult reported = future.get(context.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (reported == null) {
                return ExecutionResult.failure(ticket.id(), ExecutionErrorKind.EXECUTION_FAILURE,
                        "Implementer returned no result", snapshot(streamed), Duration.ZERO);
            }
            if (!ticket.id().equals(reported.ticketId())) {
                log.warn("Implementer reported result for {} while executing {}", reported.ticketId(), ticket.id());
                reported = new ExecutionResult(ticket.id(), reported.success(), reported.diff(), reported.logs(),
                        reported.testSummary(), reported.errorMessage(), reported.errorKind(),
                        reported.duration(), reported.metCriteria());
            }
            if (!reported.success() && reported.errorKind() == null) {
                reported = new ExecutionResult(ticket.id(), false, reported.diff(), reported.logs(),
                        reported.testSummary(), reported.errorMessage(), ExecutionErrorKind.EXECUTION_FAILURE,
                        reported.duration(), reported.metCriteria());
            }
            return reported.withLeadingLogs(snapshot(streamed));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Ticket {} exceeded its timeout of {}s", ticket.id(), context.timeout().toSeconds());
            return ExecutionResult.failure(ticket.id(), ExecutionErrorKind.EXECUTION_TIMEOUT,
                    "Execution exceeded timeout of " + context.timeout().toSeconds() + "s",
                    snapshot(streamed), Duration.ZERO);
        } catch (CancellationException e) {
            log.info("Ticket {} was cancelled", ticket.id());
            return ExecutionResult.failure(ticket.id(), ExecutionErrorKind.CANCELLED,
                    "Cancelled during execution", snapshot(streamed), Duration.ZERO);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Implementer failed on ticket {}: {}", ticket.id(), cause.getMessage());
            return ExecutionResult.failure(ticket.id(), ExecutionErrorKind.EXECUTION_FAILURE,
                    describe(cause), snapshot(streamed), Duration.ZERO);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ExecutionResult.failure(ticket.id(), ExecutionErrorKind.CANCELLED,
                    "Worker interrupted", snapshot(streamed), Duration.ZERO);
        } finally {
            inFlight.remove(key, future);
        }
    }

    private boolean cancellationRequested(WaveContext context, Ticket ticket) {
        return cancelRequested.contains(new TicketKey(context.runId(), ticket.id()))
                || context.stopRequested().getAsBoolean();
    }

    private void awaitBarrier(CountDownLatch barrier, String runId, Set<String> ids) {
        try {
            barrier.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ids.forEach(id -> cancel(runId, id));
            throw new FiveMindsException("Interrupted while waiting for wave to finish", e);
        }
    }

    private void transition(WaveContext context, Ticket ticket, TicketStatus next, String reason) {
        TicketStatus previous = ticket.transitionTo(next, reason);
        log.debug("Ticket {} {} → {}", ticket.id(), previous, next);
        eventBus.publish(FiveMindsEvent.ticketStatus(context.runId(), ticket, previous));
    }

    private static List<LogEntry> snapshot(List<LogEntry> streamed) {
        synchronized (streamed) {
            return List.copyOf(streamed);
        }
    }

    private static String outcomeTag(ExecutionResult result) {
        if (result.success()) return "success";
        return switch (result.errorKind()) {
            case EXECUTION_TIMEOUT -> "timeout";
            case SANDBOX_ACQUISITION_FAILURE -> "sandbox_failure";
            case CANCELLED -> "cancelled";
            case EXECUTION_FAILURE -> "failure";
        };
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static ThreadFactory namedDaemon(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
