package com.fiveminds.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing Five Minds MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String TICKET_ID = "ticketId";
    public static final String WAVE_NUMBER = "waveNumber";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setTicket(String runId, String ticketId) {
        MDC.put(RUN_ID, runId);
        MDC.put(TICKET_ID, ticketId);
    }

    public static void setWave(String runId, int waveNumber) {
        MDC.put(RUN_ID, runId);
        MDC.put(WAVE_NUMBER, String.valueOf(waveNumber));
    }

    /**
     * Captures the caller's MDC so a worker thread can restore it with {@link #restore}.
     */
    public static Map<String, String> capture() {
        Map<String, String> copy = MDC.getCopyOfContextMap();
        return copy != null ? copy : Map.of();
    }

    public static void restore(Map<String, String> context) {
        if (context == null || context.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(TICKET_ID);
        MDC.remove(WAVE_NUMBER);
    }
}
