package com.fiveminds.core.review;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-level heuristics over a unified diff. Findings are advisory and never feed the score.
 */
@Component
public class DiffAnalyzer {

    /** Debug output left in added lines: Python print, JS console.log, Java System.out/err. */
    private static final Pattern DEBUG_PATTERN =
            Pattern.compile("\\bprint\\(|console\\.log\\(|System\\.(out|err)\\.print");

    private static final Pattern MARKER_PATTERN = Pattern.compile("\\b(TODO|FIXME)\\b");

    public record DiffStats(int added, int removed, int debugStatements, int todoMarkers) {

        public boolean isEmpty() {
            return added == 0 && removed == 0;
        }
    }

    public DiffStats analyze(String diff) {
        if (diff == null || diff.isBlank()) {
            return new DiffStats(0, 0, 0, 0);
        }
        int added = 0, removed = 0, debug = 0, markers = 0;
        for (String line : diff.split("\\R")) {
            if (line.startsWith("+++") || line.startsWith("---")) {
                continue;
            }
            if (line.startsWith("+")) {
                added++;
                if (DEBUG_PATTERN.matcher(line).find()) debug++;
                if (MARKER_PATTERN.matcher(line).find()) markers++;
            } else if (line.startsWith("-")) {
                removed++;
            }
        }
        return new DiffStats(added, removed, debug, markers);
    }

    /**
     * Human-readable risk findings for the diff.
     */
    public List<String> findings(DiffStats stats) {
        var findings = new ArrayList<String>();
        if (stats.isEmpty()) {
            findings.add("Empty diff: no changes were produced");
            return findings;
        }
        if (stats.debugStatements() > 0) {
            findings.add("Debug statements added (" + stats.debugStatements() + ")");
        }
        if (stats.todoMarkers() > 0) {
            findings.add("TODO/FIXME markers added (" + stats.todoMarkers() + ")");
        }
        return findings;
    }
}
