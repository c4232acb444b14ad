package io.clubone.outreach.outreach.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Audit trail for outreach runs and operator actions.
 *
 * Event Types:
 * - RUN: scheduled and admin run lifecycle
 * - MANUAL_OUTREACH: single-lead triggers
 * - AUTOMATION_FAILURE: operator resolution and retry of recorded failures
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditService(JdbcTemplate jdbc, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Non-blocking: failures are logged but don't throw exceptions.
     */
    public void logEvent(String eventType, String entityType, String entityId,
                         String action, String userId, Map<String, Object> details) {
        try {
            jdbc.update("""
                INSERT INTO outreach_audit_log
                (id, event_type, entity_type, entity_id, action, user_id, details, created_on)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                UUID.randomUUID().toString(),
                eventType,
                entityType,
                entityId,
                action,
                userId,
                serializeDetails(details),
                Timestamp.from(Instant.now(clock))
            );
        } catch (DataAccessException e) {
            log.warn("Failed to log audit event (non-blocking): eventType={} entityId={} error={}",
                eventType, entityId, e.getMessage());
            log.debug("Audit logging failure details", e);
        }
    }

    public void logRunStarted(String runId, String runMode, String triggerSource) {
        Map<String, Object> details = new HashMap<>();
        details.put("runMode", runMode);
        details.put("triggerSource", triggerSource);
        logEvent("RUN", "OUTREACH_RUN", runId, "STARTED", triggerSource, details);
    }

    public void logRunCompleted(String runId, Map<String, Object> summary, String triggerSource) {
        logEvent("RUN", "OUTREACH_RUN", runId, "COMPLETED", triggerSource, summary);
    }

    public void logRunFailed(String runId, String error, String triggerSource) {
        Map<String, Object> details = new HashMap<>();
        details.put("error", error);
        logEvent("RUN", "OUTREACH_RUN", runId, "FAILED", triggerSource, details);
    }

    public void logManualOutreach(String leadRef, String reason, String dedupKey, String userId) {
        Map<String, Object> details = new HashMap<>();
        details.put("reason", reason);
        details.put("dedupKey", dedupKey);
        logEvent("MANUAL_OUTREACH", "LEAD", leadRef, "TRIGGERED", userId, details);
    }

    public void logFailureResolved(String failureId, String resolvedBy, String notes) {
        Map<String, Object> details = new HashMap<>();
        details.put("resolutionNotes", notes);
        logEvent("AUTOMATION_FAILURE", "AUTOMATION_FAILURE", failureId, "RESOLVED", resolvedBy, details);
    }

    public void logFailureRetried(String failureId, String reason, String userId) {
        Map<String, Object> details = new HashMap<>();
        details.put("reason", reason);
        logEvent("AUTOMATION_FAILURE", "AUTOMATION_FAILURE", failureId, "RETRIED", userId, details);
    }

    private String serializeDetails(Map<String, Object> details) {
        if (details == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (Exception e) {
            log.warn("Failed to serialize audit details to JSON", e);
            return null;
        }
    }
}
