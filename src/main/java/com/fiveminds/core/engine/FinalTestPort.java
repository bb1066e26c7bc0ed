package com.fiveminds.core.engine;

import com.fiveminds.core.model.FinalTestOutcome;

import java.nio.file.Path;

/**
 * Runs the repository's test suite once after integration.
 */
@FunctionalInterface
public interface FinalTestPort {

    FinalTestOutcome run(Path repository);
}
