package io.clubone.outreach.api;

import io.clubone.outreach.outreach.OutreachScheduler;
import io.clubone.outreach.outreach.RunMode;
import io.clubone.outreach.outreach.dashboard.OutreachDashboardProjector;
import io.clubone.outreach.outreach.model.ManualOutreachReason;
import io.clubone.outreach.outreach.model.ManualOutreachResult;
import io.clubone.outreach.outreach.model.OutreachDashboard;
import io.clubone.outreach.outreach.model.OutreachRunSummary;
import io.clubone.outreach.outreach.ratelimit.OutreachRateLimiter;
import io.clubone.outreach.outreach.util.LoggingUtils;
import io.clubone.outreach.repo.OutreachRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/crm/outreach")
public class OutreachController {

    private static final Logger log = LoggerFactory.getLogger(OutreachController.class);

    private final OutreachScheduler scheduler;
    private final OutreachDashboardProjector dashboardProjector;
    private final OutreachRunRepository runRepository;
    private final OutreachRateLimiter rateLimiter;

    public OutreachController(OutreachScheduler scheduler, OutreachDashboardProjector dashboardProjector,
                              OutreachRunRepository runRepository, OutreachRateLimiter rateLimiter) {
        this.scheduler = scheduler;
        this.dashboardProjector = dashboardProjector;
        this.runRepository = runRepository;
        this.rateLimiter = rateLimiter;
    }

    // POST /api/crm/outreach/run?mode=MOCK
    // POST /api/crm/outreach/run?mode=LIVE
    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(@RequestParam(name = "mode", defaultValue = "MOCK") String modeStr) {
        if (modeStr == null || modeStr.trim().isEmpty()) {
            modeStr = "MOCK";
        }

        RunMode mode;
        try {
            mode = RunMode.valueOf(modeStr.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid mode parameter: mode={}", modeStr);
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Invalid mode. Use MOCK or LIVE.",
                    "mode", modeStr
            ));
        }

        if (!rateLimiter.tryConsumeRun()) {
            log.warn("Outreach run rate limit exceeded: mode={}", mode);
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(Map.of(
                    "error", "Rate limit exceeded. Maximum 12 outreach runs per hour allowed.",
                    "retryAfter", "1 hour"
            ));
        }

        String correlationId = LoggingUtils.generateCorrelationId();
        LoggingUtils.setCorrelationId(correlationId);
        log.info("Launching outreach run: correlationId={} mode={}", correlationId, mode);
        try {
            OutreachRunSummary summary = scheduler.run(mode, "admin");
            Map<String, Object> resp = new LinkedHashMap<>();
            resp.put("correlationId", correlationId);
            resp.put("ok", summary.isOk());
            resp.put("runId", summary.getRunId());
            resp.put("mode", mode.name());
            resp.put("processed", summary.getProcessed());
            resp.put("sent", summary.getSent());
            resp.put("skipped", summary.getSkipped());
            resp.put("failed", summary.getFailed());
            resp.put("runAt", summary.getRunAt() != null ? summary.getRunAt().toString() : null);
            if (summary.getReason() != null) {
                resp.put("reason", summary.getReason());
            }
            if (mode == RunMode.MOCK) {
                resp.put("planned", summary.getPlanned());
            }
            return ResponseEntity.ok(resp);
        } catch (Exception e) {
            log.error("Failed to run outreach: correlationId={} mode={}", correlationId, mode, e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Outreach run failed. Please contact support with correlationId: " + correlationId,
                    "correlationId", correlationId,
                    "mode", mode.name()
            ));
        } finally {
            LoggingUtils.clearContext();
        }
    }

    // GET /api/crm/outreach/dashboard
    @GetMapping("/dashboard")
    public ResponseEntity<OutreachDashboard> dashboard() {
        return ResponseEntity.ok(dashboardProjector.project());
    }

    // POST /api/crm/outreach/leads/LD-1042/run
    @PostMapping("/leads/{leadRef}/run")
    public ResponseEntity<Map<String, Object>> runForLead(@PathVariable String leadRef) {
        if (!rateLimiter.tryConsumeManualTrigger()) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(Map.of(
                    "error", "Rate limit exceeded. Maximum 30 manual outreach triggers per minute allowed.",
                    "retryAfter", "1 minute"
            ));
        }

        String correlationId = LoggingUtils.generateCorrelationId();
        LoggingUtils.setCorrelationId(correlationId);
        try {
            ManualOutreachResult result = scheduler.runForLead(leadRef);
            Map<String, Object> resp = new LinkedHashMap<>();
            resp.put("correlationId", correlationId);
            resp.put("ok", result.isOk());
            resp.put("sent", result.isSent());
            resp.put("skipped", result.isSkipped());
            resp.put("failed", result.isFailed());
            resp.put("reason", result.getReason().getCode());
            resp.put("leadId", result.getLeadId());
            resp.put("dedupKey", result.getDedupKey());

            if (result.getReason() == ManualOutreachReason.LEAD_NOT_FOUND) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(resp);
            }
            if (result.getReason() == ManualOutreachReason.INVALID_LEAD) {
                return ResponseEntity.badRequest().body(resp);
            }
            return ResponseEntity.ok(resp);
        } finally {
            LoggingUtils.clearContext();
        }
    }

    // GET /api/crm/outreach/runs/{runId}
    @GetMapping("/runs/{runId}")
    public ResponseEntity<Map<String, Object>> runDetails(@PathVariable String runId) {
        try {
            Map<String, Object> run = runRepository.findRun(runId);
            if (run == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(run);
        } catch (Exception e) {
            log.error("Failed to get outreach run: runId={}", runId, e);
            throw e;
        }
    }
}
