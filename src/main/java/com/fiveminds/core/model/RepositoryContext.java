package com.fiveminds.core.model;

import java.util.List;

/**
 * Snapshot of the target repository's structure, gathered during planning.
 */
public record RepositoryContext(
    String rootPath,
    List<String> files,
    List<String> languages,
    List<String> frameworks,
    int fileCount
) {

    public static RepositoryContext empty(String rootPath) {
        return new RepositoryContext(rootPath, List.of(), List.of(), List.of(), 0);
    }
}
