package io.clubone.outreach.outreach.util;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Utility class for consistent logging with correlation IDs and context.
 */
public class LoggingUtils {

    private static final String CORRELATION_ID_KEY = "correlationId";
    private static final String RUN_ID_KEY = "outreachRunId";
    private static final String LEAD_ID_KEY = "leadId";

    private LoggingUtils() {
    }

    /**
     * Set correlation ID in MDC for distributed tracing.
     */
    public static void setCorrelationId(String correlationId) {
        if (correlationId != null) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
    }

    public static void setRunId(String runId) {
        if (runId != null) {
            MDC.put(RUN_ID_KEY, runId);
        }
    }

    public static void setLeadId(String leadId) {
        if (leadId != null) {
            MDC.put(LEAD_ID_KEY, leadId);
        } else {
            MDC.remove(LEAD_ID_KEY);
        }
    }

    /**
     * Clear all MDC context.
     */
    public static void clearContext() {
        MDC.clear();
    }

    /**
     * Log error with lead and run context attached.
     */
    public static void logError(Logger logger, String message, String leadId, String runId, Throwable error) {
        setLeadId(leadId);
        setRunId(runId);
        logger.error("{} leadId={} outreachRunId={}", message, leadId, runId, error);
    }

    /**
     * Keep the caller's correlation ID when one is already set.
     */
    public static String ensureCorrelationId() {
        String existing = MDC.get(CORRELATION_ID_KEY);
        if (existing != null) {
            return existing;
        }
        String generated = generateCorrelationId();
        MDC.put(CORRELATION_ID_KEY, generated);
        return generated;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }
}
