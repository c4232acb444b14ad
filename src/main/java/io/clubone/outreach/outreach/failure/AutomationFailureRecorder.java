package io.clubone.outreach.outreach.failure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clubone.outreach.outreach.audit.AuditService;
import io.clubone.outreach.outreach.model.AutomationFailure;
import io.clubone.outreach.repo.SafeJdbc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persists non-fatal dispatch and tagging errors for operator follow-up.
 * One open row per event: a repeated failure of the same event refreshes that row.
 */
@Service
public class AutomationFailureRecorder {

    private static final Logger log = LoggerFactory.getLogger(AutomationFailureRecorder.class);

    public static final String STATUS_OPEN = "failed";
    public static final String STATUS_RESOLVED = "resolved";
    static final int MAX_ERROR_LENGTH = 500;

    private static final String COLUMNS =
        "id, lead_id, booking_id, event, status, attempts, last_error, payload, created_at, updated_at";

    private static final RowMapper<AutomationFailure> FAILURE_MAPPER = (rs, rowNum) -> {
        AutomationFailure failure = new AutomationFailure();
        failure.setId(rs.getString("id"));
        failure.setLeadId(rs.getString("lead_id"));
        failure.setBookingId(rs.getString("booking_id"));
        failure.setEvent(rs.getString("event"));
        failure.setStatus(rs.getString("status"));
        failure.setAttempts(rs.getInt("attempts"));
        failure.setLastError(rs.getString("last_error"));
        failure.setPayload(rs.getString("payload"));
        failure.setCreatedAt(SafeJdbc.instant(rs.getTimestamp("created_at")));
        failure.setUpdatedAt(SafeJdbc.instant(rs.getTimestamp("updated_at")));
        return failure;
    };

    private final SafeJdbc db;
    private final ObjectMapper objectMapper;
    private final AuditService auditService;
    private final Clock clock;

    public AutomationFailureRecorder(SafeJdbc db, ObjectMapper objectMapper, AuditService auditService, Clock clock) {
        this.db = db;
        this.objectMapper = objectMapper;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Never throws; a failure that cannot be stored is logged at ERROR instead.
     */
    public void record(String leadId, String bookingRef, String event, String errorMessage, int attempts,
                       Map<String, Object> payload) {
        String safeEvent = event == null || event.isBlank() ? "automation.unknown" : event.trim();
        String error = truncate(errorMessage == null || errorMessage.isBlank() ? "Unknown automation error" : errorMessage.trim());
        int safeAttempts = Math.max(0, attempts);
        Instant now = Instant.now(clock);
        String payloadJson = toJson(payload);

        int updated = db.update("automation_failures",
            "UPDATE automation_failures SET attempts = ?, last_error = ?, payload = ?, updated_at = ? " +
            "WHERE event = ? AND status = ?",
            safeAttempts, error, payloadJson, SafeJdbc.timestamp(now), safeEvent, STATUS_OPEN);
        if (updated > 0) {
            log.warn("Automation failure refreshed: event={} attempts={} error={}", safeEvent, safeAttempts, error);
            return;
        }

        boolean inserted = db.insert("automation_failures",
            "INSERT INTO automation_failures (id, lead_id, booking_id, event, status, attempts, last_error, payload, " +
            "created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            UUID.randomUUID().toString(), leadId, bookingRef, safeEvent, STATUS_OPEN, safeAttempts, error, payloadJson,
            SafeJdbc.timestamp(now), SafeJdbc.timestamp(now));
        if (inserted) {
            log.warn("Automation failure recorded: event={} leadId={} attempts={} error={}",
                safeEvent, leadId, safeAttempts, error);
        } else {
            log.error("Automation failure could not be stored: event={} leadId={} error={}", safeEvent, leadId, error);
        }
    }

    /**
     * Open failures whose event matches a SQL LIKE pattern, newest first.
     */
    public List<AutomationFailure> openFailures(String eventPattern, int limit) {
        return db.selectMany("automation_failures",
            "SELECT " + COLUMNS + " FROM automation_failures WHERE status = ? AND event LIKE ? " +
            "ORDER BY updated_at DESC LIMIT ?",
            FAILURE_MAPPER, STATUS_OPEN, eventPattern, limit);
    }

    public int openCount(String eventPattern) {
        List<Integer> rows = db.selectMany("automation_failures",
            "SELECT COUNT(1) FROM automation_failures WHERE status = ? AND event LIKE ?",
            (rs, rowNum) -> rs.getInt(1), STATUS_OPEN, eventPattern);
        return rows.isEmpty() ? 0 : rows.get(0);
    }

    public int resolvedCount(String eventPattern) {
        List<Integer> rows = db.selectMany("automation_failures",
            "SELECT COUNT(1) FROM automation_failures WHERE status = ? AND event LIKE ?",
            (rs, rowNum) -> rs.getInt(1), STATUS_RESOLVED, eventPattern);
        return rows.isEmpty() ? 0 : rows.get(0);
    }

    /**
     * Whether any row for the event, open or resolved, was raised or touched at or after {@code since}.
     */
    public boolean hasRecordSince(String event, Instant since) {
        List<Integer> rows = db.selectMany("automation_failures",
            "SELECT COUNT(1) FROM automation_failures WHERE event = ? AND (created_at >= ? OR updated_at >= ?)",
            (rs, rowNum) -> rs.getInt(1), event, SafeJdbc.timestamp(since), SafeJdbc.timestamp(since));
        return !rows.isEmpty() && rows.get(0) > 0;
    }

    public AutomationFailure findById(String id) {
        List<AutomationFailure> rows = db.selectMany("automation_failures",
            "SELECT " + COLUMNS + " FROM automation_failures WHERE id = ?", FAILURE_MAPPER, id);
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * @return false when the row does not exist or the write did not land
     */
    public boolean markResolved(String id, String resolvedBy, String resolutionNotes) {
        int updated = db.update("automation_failures",
            "UPDATE automation_failures SET status = ?, resolved_by = ?, resolution_notes = ?, updated_at = ? WHERE id = ?",
            STATUS_RESOLVED, resolvedBy, resolutionNotes, SafeJdbc.timestamp(Instant.now(clock)), id);
        if (updated <= 0) {
            return false;
        }
        log.info("Marked automation failure as resolved: id={} resolvedBy={}", id, resolvedBy);
        auditService.logFailureResolved(id, resolvedBy, resolutionNotes);
        return true;
    }

    public void incrementAttempts(String id) {
        db.update("automation_failures",
            "UPDATE automation_failures SET attempts = attempts + 1, updated_at = ? WHERE id = ?",
            SafeJdbc.timestamp(Instant.now(clock)), id);
        log.info("Incremented automation failure attempts: id={}", id);
    }

    private String toJson(Map<String, Object> payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize failure payload: error={}", e.getMessage());
            return null;
        }
    }

    static String truncate(String value) {
        if (value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH - 1) + "…";
    }
}
