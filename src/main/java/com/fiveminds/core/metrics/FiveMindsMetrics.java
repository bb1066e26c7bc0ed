package com.fiveminds.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for orchestration runs.
 */
@Service
public class FiveMindsMetrics {

    private final MeterRegistry registry;

    public FiveMindsMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("fiveminds.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "success", "failure", "timeout", "sandbox_failure" or "cancelled"
     */
    public void recordTicketExecution(String outcome, Duration elapsed) {
        Timer.builder("fiveminds.ticket.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsed);
    }

    public void recordReviewVerdict(boolean approved, double alignmentScore) {
        Counter.builder("fiveminds.review.verdicts")
                .tag("result", approved ? "approved" : "rejected")
                .register(registry)
                .increment();

        DistributionSummary.builder("fiveminds.review.alignment")
                .register(registry)
                .record(alignmentScore);
    }

    public void recordFollowUps(int count) {
        Counter.builder("fiveminds.review.follow_ups")
                .description("Follow-up tickets synthesized by the review gate")
                .register(registry)
                .increment(count);
    }

    /**
     * Records wave execution metrics.
     *
     * @param ticketCount number of tickets in the wave
     * @param poolSize    worker pool size used for the wave
     */
    public void recordWaveExecution(int ticketCount, int poolSize) {
        Counter.builder("fiveminds.wave.executions")
                .description("Waves executed")
                .register(registry)
                .increment();

        DistributionSummary.builder("fiveminds.wave.ticket_count")
                .description("Number of tickets per wave")
                .register(registry)
                .record(ticketCount);

        DistributionSummary.builder("fiveminds.wave.pool_size")
                .register(registry)
                .record(poolSize);
    }

    /**
     * Records sandbox lifecycle operations.
     *
     * @param operation "acquire" or "release"
     * @param success   whether the operation succeeded
     */
    public void recordSandboxOperation(String operation, boolean success) {
        Counter.builder("fiveminds.sandbox.operations")
                .description("Sandbox lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordRunResult(String phase) {
        Counter.builder("fiveminds.runs.total")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordGenerationDepth(int depth) {
        DistributionSummary.builder("fiveminds.run.generations")
                .register(registry)
                .record(depth);
    }
}
