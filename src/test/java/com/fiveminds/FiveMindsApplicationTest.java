package com.fiveminds;

import com.fiveminds.core.engine.Orchestrator;
import com.fiveminds.core.engine.RunReportWriter;
import com.fiveminds.core.model.Objective;
import com.fiveminds.core.model.RunPhase;
import com.fiveminds.core.model.TicketStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "fiveminds.sandbox.max-runners=2",
        "fiveminds.run.max-follow-up-depth=0"
})
class FiveMindsApplicationTest {

    @Autowired
    private Orchestrator orchestrator;

    @Autowired
    private RunReportWriter reportWriter;

    @Test
    @DisplayName("default wiring runs an objective end to end and fails tickets without an implementer")
    void defaultWiring() {
        var config = orchestrator.defaultConfig();
        assertEquals(2, config.maxRunners());
        assertEquals(0, config.maxFollowUpDepth());

        var report = orchestrator.run(new Objective("Smoke", List.of("Add feature")));

        assertEquals(RunPhase.COMPLETED, report.finalPhase());
        assertEquals(TicketStatus.FAILED, report.outcome("TKT-001").status());
        assertTrue(report.outcome("TKT-001").reason().contains("No implementer configured"));
        assertTrue(reportWriter.summary(report).contains("TKT-001 FAILED"));
    }
}
