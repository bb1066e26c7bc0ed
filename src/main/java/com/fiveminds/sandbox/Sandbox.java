package com.fiveminds.sandbox;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An exclusively-owned, ephemeral workspace for one ticket execution.
 * <p>
 * Acquire with {@link SandboxLifecycle#acquire} inside a try-with-resources block;
 * closing the sandbox releases it. Release is idempotent.
 */
public final class Sandbox implements AutoCloseable {

    private final String id;
    private final String ticketId;
    private final Path workspace;
    private final Instant createdAt;
    private final SandboxLifecycle owner;
    private final AtomicBoolean released = new AtomicBoolean(false);

    Sandbox(String id, String ticketId, Path workspace, SandboxLifecycle owner) {
        this.id = id;
        this.ticketId = ticketId;
        this.workspace = workspace;
        this.createdAt = Instant.now();
        this.owner = owner;
    }

    public String id() { return id; }
    public String ticketId() { return ticketId; }
    public Path workspace() { return workspace; }
    public Instant createdAt() { return createdAt; }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Flips the released flag; true only for the first caller.
     */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        owner.release(this);
    }

    @Override
    public String toString() {
        return "Sandbox[" + id + " for " + ticketId + " at " + workspace + "]";
    }
}
