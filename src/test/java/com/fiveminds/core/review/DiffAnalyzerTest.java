package com.fiveminds.core.review;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffAnalyzerTest {

    private final DiffAnalyzer analyzer = new DiffAnalyzer();

    @Test
    @DisplayName("counts added and removed lines, ignoring file headers")
    void countsLines() {
        String diff = """
                --- a/service.py
                +++ b/service.py
                @@ -3,4 +3,5 @@
                -old = 1
                +new = 2
                +print(new)
                 unchanged
                """;

        var stats = analyzer.analyze(diff);

        assertEquals(2, stats.added());
        assertEquals(1, stats.removed());
        assertEquals(1, stats.debugStatements());
        assertEquals(0, stats.todoMarkers());
    }

    @Test
    @DisplayName("debug output and markers on removed lines are not findings")
    void removedLinesIgnored() {
        var stats = analyzer.analyze("-System.out.println(x);\n-// FIXME\n+int y = 1;\n");

        assertEquals(0, stats.debugStatements());
        assertEquals(0, stats.todoMarkers());
        assertTrue(analyzer.findings(stats).isEmpty());
    }

    @Test
    @DisplayName("reports Java debug output and FIXME markers")
    void javaFindings() {
        var stats = analyzer.analyze("+System.err.println(\"here\");\n+// FIXME: handle null\n+// TODO later\n");

        assertEquals(List.of("Debug statements added (1)", "TODO/FIXME markers added (2)"), analyzer.findings(stats));
    }

    @Test
    @DisplayName("an empty diff is reported on its own")
    void emptyDiff() {
        assertTrue(analyzer.analyze(null).isEmpty());
        assertEquals(List.of("Empty diff: no changes were produced"), analyzer.findings(analyzer.analyze("  ")));
    }
}
