package io.clubone.outreach.api;

import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.OutreachScheduler;
import io.clubone.outreach.outreach.audit.AuditService;
import io.clubone.outreach.outreach.failure.AutomationFailureRecorder;
import io.clubone.outreach.outreach.model.AutomationFailure;
import io.clubone.outreach.outreach.model.ManualOutreachReason;
import io.clubone.outreach.outreach.model.ManualOutreachResult;
import io.clubone.outreach.outreach.model.Opportunity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for reviewing and recovering outreach automation failures.
 */
@RestController
@RequestMapping("/api/automation/failures")
public class AutomationFailureController {

    private static final Logger log = LoggerFactory.getLogger(AutomationFailureController.class);

    private static final int MAX_LIMIT = 500;

    private final AutomationFailureRecorder failureRecorder;
    private final OutreachScheduler scheduler;
    private final AuditService auditService;
    private final OutreachProperties props;

    public AutomationFailureController(AutomationFailureRecorder failureRecorder, OutreachScheduler scheduler,
                                       AuditService auditService, OutreachProperties props) {
        this.failureRecorder = failureRecorder;
        this.scheduler = scheduler;
        this.auditService = auditService;
        this.props = props;
    }

    /**
     * GET /api/automation/failures?limit=80
     */
    @GetMapping
    public ResponseEntity<List<AutomationFailure>> openFailures(@RequestParam(name = "limit", defaultValue = "80") int limit) {
        if (limit <= 0) {
            log.warn("Invalid limit parameter: limit={}", limit);
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(failureRecorder.openFailures(Opportunity.failureEventPattern(), Math.min(limit, MAX_LIMIT)));
    }

    /**
     * GET /api/automation/failures/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        int open = failureRecorder.openCount(Opportunity.failureEventPattern());
        int resolved = failureRecorder.resolvedCount(Opportunity.failureEventPattern());
        return ResponseEntity.ok(Map.of(
            "openCount", open,
            "resolvedCount", resolved,
            "status", open > 100 ? "WARNING" : "OK"
        ));
    }

    /**
     * POST /api/automation/failures/{id}/resolve
     */
    @PostMapping("/{id}/resolve")
    public ResponseEntity<Map<String, Object>> resolve(@PathVariable String id,
                                                       @RequestBody(required = false) Map<String, String> request) {
        Map<String, String> body = request != null ? request : Map.of();
        String resolvedBy = body.getOrDefault("resolvedBy", "system");
        String notes = body.getOrDefault("notes", "");

        if (failureRecorder.findById(id) == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Automation failure not found.", "id", id));
        }
        if (!failureRecorder.markResolved(id, resolvedBy, notes)) {
            return ResponseEntity.internalServerError().body(Map.of("error", "Automation failure could not be updated.", "id", id));
        }
        return ResponseEntity.ok(Map.of("id", id, "status", AutomationFailureRecorder.STATUS_RESOLVED));
    }

    /**
     * Retries the outreach step the failure was raised for. Tagging failures and steps the drip
     * has already moved past are refused with 409.
     * POST /api/automation/failures/{id}/retry
     */
    @PostMapping("/{id}/retry")
    public ResponseEntity<Map<String, Object>> retry(@PathVariable String id) {
        AutomationFailure failure = failureRecorder.findById(id);
        if (failure == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Automation failure not found.", "id", id));
        }
        if (!AutomationFailureRecorder.STATUS_OPEN.equals(failure.getStatus())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "Automation failure is not open.", "id", id));
        }
        if (failure.getAttempts() >= props.getRetry().getMaxAttempts()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "error", "Retry budget exhausted.", "id", id, "attempts", failure.getAttempts()));
        }
        if (!OutreachScheduler.isRetryableKey(failure.getEvent())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "error", "Automation failure is not an outreach step.", "id", id, "event", failure.getEvent()));
        }

        failureRecorder.incrementAttempts(id);
        ManualOutreachResult result = scheduler.retryStep(failure.getEvent());
        auditService.logFailureRetried(id, result.getReason().getCode(), "admin");
        if (result.getReason() == ManualOutreachReason.NOT_RETRYABLE) {
            log.info("Automation failure retry refused: id={} event={}", id, failure.getEvent());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                "error", "Outreach step can no longer be retried.", "id", id, "reason", result.getReason().getCode()));
        }
        boolean resolved = result.isSent() && failure.getEvent().equals(result.getDedupKey())
            && failureRecorder.markResolved(id, "retry", "Resolved by retry send");
        log.info("Automation failure retried: id={} event={} reason={} resolved={}",
            id, failure.getEvent(), result.getReason(), resolved);

        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("id", id);
        resp.put("reason", result.getReason().getCode());
        resp.put("dedupKey", result.getDedupKey());
        resp.put("resolved", resolved);
        return ResponseEntity.ok(resp);
    }
}
