package com.fiveminds.core.engine;

import com.fiveminds.sandbox.SandboxProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings for one run, validated on construction.
 *
 * @param maxRunners        worker pool size per wave, at least 1
 * @param ticketTimeout     per-ticket execution limit, positive
 * @param approvalThreshold minimum alignment score for approval, within [0, 1]
 * @param maxFollowUpDepth  how many generations of follow-ups may be executed, at least 0
 * @param repositoryPath    target repository, or {@code null} to run without one
 */
public record RunConfig(
    int maxRunners,
    Duration ticketTimeout,
    double approvalThreshold,
    int maxFollowUpDepth,
    Path repositoryPath
) {

    public RunConfig {
        if (maxRunners < 1) {
            throw new IllegalArgumentException("maxRunners must be at least 1, got " + maxRunners);
        }
        if (ticketTimeout == null || ticketTimeout.isZero() || ticketTimeout.isNegative()) {
            throw new IllegalArgumentException("Ticket timeout must be positive, got " + ticketTimeout);
        }
        if (approvalThreshold < 0.0 || approvalThreshold > 1.0 || Double.isNaN(approvalThreshold)) {
            throw new IllegalArgumentException("Approval threshold must be within [0, 1], got " + approvalThreshold);
        }
        if (maxFollowUpDepth < 0) {
            throw new IllegalArgumentException("maxFollowUpDepth must not be negative, got " + maxFollowUpDepth);
        }
    }

    public static RunConfig from(SandboxProperties sandbox, RunProperties run) {
        String repo = run.getRepositoryPath();
        return new RunConfig(sandbox.getMaxRunners(), sandbox.getTimeout(), run.getApprovalThreshold(),
                run.getMaxFollowUpDepth(), repo == null || repo.isBlank() ? null : Path.of(repo));
    }

    public RunConfig withRepositoryPath(Path path) {
        return new RunConfig(maxRunners, ticketTimeout, approvalThreshold, maxFollowUpDepth, path);
    }

    public RunConfig withMaxFollowUpDepth(int depth) {
        return new RunConfig(maxRunners, ticketTimeout, approvalThreshold, depth, repositoryPath);
    }
}
