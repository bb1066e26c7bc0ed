package com.fiveminds.sandbox;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Abstraction for preparing and destroying sandbox workspaces.
 * Implementations: {@link LocalCopySandboxProvider} (directory copy).
 */
public interface SandboxProvider {

    /**
     * Creates a fresh workspace for one sandbox, seeded from {@code baseSnapshot}.
     *
     * @param sandboxId    unique sandbox identifier, usable as a directory name
     * @param baseSnapshot directory to copy, or {@code null} for an empty workspace
     * @return path of the new workspace
     */
    Path create(String sandboxId, Path baseSnapshot) throws IOException;

    /**
     * Removes a workspace created by {@link #create}. Must tolerate a partially
     * created or already removed workspace.
     */
    void destroy(Path workspace) throws IOException;
}
