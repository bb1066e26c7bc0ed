package com.fiveminds.sandbox;

import com.fiveminds.core.metrics.FiveMindsMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates exclusively-owned sandboxes and guarantees their teardown.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Delegates workspace preparation and removal to {@link SandboxProvider}</li>
 *   <li>Tracks live sandboxes so leaks are observable via {@link #activeCount()}</li>
 *   <li>Enforces the optional {@code maxActive} bound from {@link SandboxProperties}</li>
 * </ul>
 */
@Service
public class SandboxLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SandboxLifecycle.class);

    private final SandboxProvider provider;
    private final SandboxProperties properties;
    private final FiveMindsMetrics metrics;
    private final Map<String, Sandbox> active = new ConcurrentHashMap<>();
    private final AtomicLong counter = new AtomicLong();
    /** Slots held by live sandboxes and by acquisitions still preparing their workspace. */
    private final AtomicInteger reserved = new AtomicInteger();

    public SandboxLifecycle(SandboxProvider provider, SandboxProperties properties, FiveMindsMetrics metrics) {
        this.provider = provider;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Prepares a private workspace for {@code ticketId}. Callers must close the
     * returned sandbox, normally through try-with-resources.
     *
     * @param baseSnapshot directory the workspace is copied from, or {@code null} for an empty one
     * @throws SandboxAcquisitionException if the workspace cannot be prepared
     */
    public Sandbox acquire(String ticketId, Path baseSnapshot) {
        int limit = properties.getMaxActive();
        if (reserved.incrementAndGet() > limit && limit > 0) {
            reserved.decrementAndGet();
            metrics.recordSandboxOperation("acquire", false);
            throw new SandboxAcquisitionException(
                    "Sandbox limit of " + limit + " reached; cannot acquire for ticket " + ticketId);
        }

        String sandboxId = "sbx-" + sanitize(ticketId) + "-" + counter.incrementAndGet();
        Path workspace;
        try {
            workspace = provider.create(sandboxId, baseSnapshot);
        } catch (IOException | RuntimeException e) {
            reserved.decrementAndGet();
            metrics.recordSandboxOperation("acquire", false);
            throw new SandboxAcquisitionException(
                    "Failed to prepare sandbox for ticket " + ticketId + ": " + e.getMessage(), e);
        }

        var sandbox = new Sandbox(sandboxId, ticketId, workspace, this);
        active.put(sandboxId, sandbox);
        metrics.recordSandboxOperation("acquire", true);
        log.debug("Acquired sandbox {} for ticket {} at {}", sandboxId, ticketId, workspace);
        return sandbox;
    }

    /**
     * Tears the sandbox down. Safe to call more than once; only the first call has an effect.
     * Teardown failures are logged and counted, never thrown.
     */
    public void release(Sandbox sandbox) {
        if (sandbox == null || !sandbox.markReleased()) {
            return;
        }
        active.remove(sandbox.id());
        reserved.decrementAndGet();
        try {
            provider.destroy(sandbox.workspace());
            metrics.recordSandboxOperation("release", true);
            log.debug("Released sandbox {} for ticket {}", sandbox.id(), sandbox.ticketId());
        } catch (IOException | RuntimeException e) {
            metrics.recordSandboxOperation("release", false);
            log.warn("Failed to tear down sandbox {} at {}: {}", sandbox.id(), sandbox.workspace(), e.getMessage());
        }
    }

    public int activeCount() {
        return active.size();
    }

    public List<Sandbox> activeSandboxes() {
        return List.copyOf(active.values());
    }

    private static String sanitize(String ticketId) {
        return ticketId == null ? "unknown" : ticketId.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
