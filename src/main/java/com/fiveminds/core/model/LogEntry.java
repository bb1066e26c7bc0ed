package com.fiveminds.core.model;

import java.time.Instant;

/**
 * One line of an execution log.
 */
public record LogEntry(Instant timestamp, String message) {

    public static LogEntry now(String message) {
        return new LogEntry(Instant.now(), message);
    }
}
