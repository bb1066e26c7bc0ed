package com.fiveminds.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Set;

/**
 * Builds sandboxes as private copies of the repository snapshot under a root directory.
 * <p>
 * Version-control metadata, dependency caches and build output listed in the
 * exclusion set are not copied.
 */
public class LocalCopySandboxProvider implements SandboxProvider {

    private static final Logger log = LoggerFactory.getLogger(LocalCopySandboxProvider.class);

    private final Path root;
    private final Set<String> excludes;

    public LocalCopySandboxProvider(Path root, Set<String> excludes) {
        this.root = root;
        this.excludes = Set.copyOf(excludes);
    }

    @Override
    public Path create(String sandboxId, Path baseSnapshot) throws IOException {
        Files.createDirectories(root);
        Path workspace = Files.createTempDirectory(root, sandboxId + "-");
        if (baseSnapshot == null) {
            return workspace;
        }
        if (!Files.isDirectory(baseSnapshot)) {
            destroy(workspace);
            throw new NoSuchFileException(baseSnapshot.toString(), null, "base snapshot is not a directory");
        }
        try {
            copyTree(baseSnapshot, workspace);
        } catch (IOException e) {
            destroy(workspace);
            throw e;
        }
        log.debug("Copied {} into sandbox {}", baseSnapshot, workspace);
        return workspace;
    }

    @Override
    public void destroy(Path workspace) throws IOException {
        if (workspace == null || !Files.exists(workspace)) return;
        Files.walkFileTree(workspace, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) throw exc;
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(source) && excludes.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (excludes.contains(file.getFileName().toString())) {
                    return FileVisitResult.CONTINUE;
                }
                Files.copy(file, target.resolve(source.relativize(file).toString()),
                        StandardCopyOption.COPY_ATTRIBUTES, StandardCopyOption.REPLACE_EXISTING);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
