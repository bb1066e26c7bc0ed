package com.fiveminds.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fiveminds.core.FiveMindsException;
import com.fiveminds.core.model.RunReport;
import com.fiveminds.core.model.TicketOutcome;
import com.fiveminds.core.model.TicketStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Renders a {@link RunReport} as JSON or as a plain-text summary.
 */
@Component
public class RunReportWriter {

    private static final Logger log = LoggerFactory.getLogger(RunReportWriter.class);

    private final ObjectMapper objectMapper;

    public RunReportWriter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(RunReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new FiveMindsException("Failed to serialize report for run " + report.runId(), e);
        }
    }

    public RunReport fromJson(String json) {
        try {
            return objectMapper.readValue(json, RunReport.class);
        } catch (JsonProcessingException e) {
            throw new FiveMindsException("Failed to parse run report: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Writes the JSON report to {@code target}, creating parent directories.
     */
    public Path write(RunReport report, Path target) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        Files.writeString(target, toJson(report));
        log.info("Wrote report for run {} to {}", report.runId(), target);
        return target;
    }

    public String summary(RunReport report) {
        var sb = new StringBuilder();
        sb.append("Run ").append(report.runId()).append(": ").append(report.finalPhase()).append('\n');
        sb.append("Objective: ").append(report.objective()).append('\n');
        if (report.fatalReason() != null) {
            sb.append("Reason: ").append(report.fatalReason()).append('\n');
        }
        if (report.startedAt() != null && report.finishedAt() != null) {
            Duration elapsed = Duration.between(report.startedAt(), report.finishedAt());
            sb.append("Duration: ").append(elapsed.toMillis()).append("ms\n");
        }
        sb.append("Waves: ").append(report.wavesExecuted())
          .append(", generations: ").append(report.generationsExecuted()).append('\n');

        sb.append("Tickets (").append(report.tickets().size()).append("):\n");
        for (TicketOutcome ticket : report.tickets()) {
            sb.append("  ").append(ticket.ticketId()).append(' ').append(ticket.status());
            if (ticket.alignmentScore() != null) {
                sb.append(String.format(Locale.ROOT, " [%.2f]", ticket.alignmentScore()));
            }
            if (ticket.followUp()) {
                sb.append(" (follow-up)");
            }
            sb.append(" - ").append(ticket.title());
            if (ticket.status() != TicketStatus.APPROVED && ticket.reason() != null) {
                sb.append(": ").append(ticket.reason());
            }
            sb.append('\n');
        }

        var reviews = report.reviewSummary();
        if (reviews != null) {
            sb.append(String.format(Locale.ROOT, "Reviews: %d (%d approved, %d rejected), approval rate %.0f%%, average alignment %.2f%n",
                    reviews.totalReviews(), reviews.approved(), reviews.rejected(),
                    reviews.approvalRate() * 100, reviews.averageAlignmentScore()));
        }
        if (!report.deferredFollowUps().isEmpty()) {
            sb.append("Deferred follow-ups:\n");
            report.deferredFollowUps().forEach(t ->
                    sb.append("  ").append(t.ticketId()).append(" - ").append(t.title()).append('\n'));
        }
        if (report.integration() != null) {
            sb.append("Integration: ").append(report.integration().success() ? "succeeded" : "not applied")
              .append(" (").append(report.integration().patchesApplied()).append(" changes)\n");
        }
        if (report.finalTests() != null) {
            sb.append("Final tests: ").append(report.finalTests().passed() ? "passed" : "not passed")
              .append(" - ").append(report.finalTests().summary()).append('\n');
        }
        return sb.toString();
    }
}
