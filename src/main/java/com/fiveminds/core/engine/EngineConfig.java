package com.fiveminds.core.engine;

import com.fiveminds.core.execution.ImplementerPort;
import com.fiveminds.core.model.ExecutionErrorKind;
import com.fiveminds.core.model.ExecutionResult;
import com.fiveminds.core.model.FinalTestOutcome;
import com.fiveminds.core.model.IntegrationOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fallback wiring for the external collaborators. Each bean backs off when the
 * application supplies its own.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Fails every ticket; a real implementer must be provided to produce changes.
     */
    @Bean
    @ConditionalOnMissingBean
    public ImplementerPort implementerPort() {
        return request -> {
            log.warn("No implementer configured, failing ticket {}", request.ticket().id());
            return ExecutionResult.failure(request.ticket().id(), ExecutionErrorKind.EXECUTION_FAILURE,
                    "No implementer configured", List.of(), Duration.ZERO);
        };
    }

    /**
     * Records the approved changes without applying them.
     */
    @Bean
    @ConditionalOnMissingBean
    public IntegratorPort integratorPort() {
        return approved -> {
            var lines = new ArrayList<String>();
            for (ExecutionResult result : approved) {
                int size = result.diff().isEmpty() ? 0 : result.diff().split("\\R").length;
                lines.add("Accepted change for " + result.ticketId() + " (" + size + " diff lines)");
                log.info("Accepted change for {} ({} diff lines)", result.ticketId(), size);
            }
            return new IntegrationOutcome(true, approved.size(), lines);
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public FinalTestPort finalTestPort() {
        return repository -> FinalTestOutcome.notRun("No final test command configured for " + repository);
    }
}
