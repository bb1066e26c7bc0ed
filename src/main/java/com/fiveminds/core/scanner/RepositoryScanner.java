package com.fiveminds.core.scanner;

import com.fiveminds.core.model.RepositoryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Walks a repository and builds a {@link RepositoryContext} snapshot containing the
 * file list, detected languages and detected frameworks.
 * <p>
 * Hidden entries and common dependency, build and IDE directories (e.g. {@code .git},
 * {@code node_modules}, {@code target}) are excluded from the scan.
 */
@Service
public class RepositoryScanner {

    private static final Logger log = LoggerFactory.getLogger(RepositoryScanner.class);

    /** Directories to skip during the walk, in addition to hidden ones. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            "node_modules", "__pycache__", "venv", "env", "target", "build",
            "dist", "out"
    );

    private static final Map<String, String> LANGUAGES_BY_EXTENSION = Map.ofEntries(
            Map.entry("py", "Python"),
            Map.entry("js", "JavaScript"),
            Map.entry("jsx", "JavaScript"),
            Map.entry("ts", "TypeScript"),
            Map.entry("tsx", "TypeScript"),
            Map.entry("java", "Java"),
            Map.entry("kt", "Kotlin"),
            Map.entry("go", "Go"),
            Map.entry("rs", "Rust")
    );

    private static final Map<String, String> FRAMEWORKS_BY_MANIFEST = Map.of(
            "package.json", "Node.js",
            "requirements.txt", "Python",
            "setup.py", "Python",
            "pyproject.toml", "Python",
            "Cargo.toml", "Rust/Cargo",
            "go.mod", "Go/Modules",
            "pom.xml", "Maven",
            "build.gradle", "Gradle",
            "build.gradle.kts", "Gradle"
    );

    /**
     * Scans the given repository root.
     *
     * @throws IOException if the directory walk fails
     */
    public RepositoryContext scan(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Repository path is not a directory: " + root);
        }
        var files = new ArrayList<String>();
        var languages = new TreeSet<String>();
        var frameworks = new TreeSet<String>();

        try (var stream = Files.walk(root)) {
            stream.filter(Files::isRegularFile)
                  .filter(p -> !shouldIgnore(root, p))
                  .forEach(p -> {
                      files.add(root.relativize(p).toString().replace('\\', '/'));
                      String name = p.getFileName().toString();
                      String language = LANGUAGES_BY_EXTENSION.get(extension(name));
                      if (language != null) languages.add(language);
                      String framework = FRAMEWORKS_BY_MANIFEST.get(name);
                      if (framework != null) frameworks.add(framework);
                  });
        }
        files.sort(String::compareTo);

        log.info("Repository analysis complete: {} files, {} languages, {} frameworks",
                files.size(), languages.size(), frameworks.size());
        return new RepositoryContext(root.toString(), List.copyOf(files),
                List.copyOf(languages), List.copyOf(frameworks), files.size());
    }

    /**
     * A path is ignored when any component is hidden or names an ignored directory.
     */
    private boolean shouldIgnore(Path root, Path path) {
        for (Path component : root.relativize(path)) {
            String name = component.toString();
            if (name.startsWith(".") || IGNORE_DIRS.contains(name)) return true;
        }
        return false;
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot + 1) : "";
    }
}
