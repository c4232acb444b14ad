package io.clubone.outreach.api;

import io.clubone.outreach.outreach.OutreachScheduler;
import io.clubone.outreach.outreach.RunMode;
import io.clubone.outreach.outreach.dashboard.OutreachDashboardProjector;
import io.clubone.outreach.outreach.model.DispatchOutcome;
import io.clubone.outreach.outreach.model.ManualOutreachReason;
import io.clubone.outreach.outreach.model.ManualOutreachResult;
import io.clubone.outreach.outreach.model.OutreachDashboard;
import io.clubone.outreach.outreach.model.OutreachRunSummary;
import io.clubone.outreach.outreach.ratelimit.OutreachRateLimiter;
import io.clubone.outreach.repo.OutreachRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OutreachControllerTest {

	@Mock
	private OutreachScheduler scheduler;

	@Mock
	private OutreachDashboardProjector dashboardProjector;

	@Mock
	private OutreachRunRepository runRepository;

	@Mock
	private OutreachRateLimiter rateLimiter;

	private MockMvc mvc;

	@BeforeEach
	void setUp() {
		mvc = MockMvcBuilders.standaloneSetup(
			new OutreachController(scheduler, dashboardProjector, runRepository, rateLimiter)).build();
	}

	@Test
	void runDefaultsToMockAndReturnsPlan() throws Exception {
		OutreachRunSummary summary = new OutreachRunSummary();
		summary.setOk(true);
		summary.setRunId("run-1");
		summary.setMode(RunMode.MOCK);
		summary.setProcessed(1);
		summary.setRunAt(Instant.parse("2026-03-10T12:00:00Z"));
		summary.setPlanned(List.of("crm_outreach:quote_followup:L1:quote_followup_1"));
		when(rateLimiter.tryConsumeRun()).thenReturn(true);
		when(scheduler.run(RunMode.MOCK, "admin")).thenReturn(summary);

		mvc.perform(post("/api/crm/outreach/run"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.ok").value(true))
			.andExpect(jsonPath("$.mode").value("MOCK"))
			.andExpect(jsonPath("$.runId").value("run-1"))
			.andExpect(jsonPath("$.planned[0]").value("crm_outreach:quote_followup:L1:quote_followup_1"))
			.andExpect(jsonPath("$.correlationId").exists());
	}

	@Test
	void notConfiguredRunIsReportedNotFailed() throws Exception {
		when(rateLimiter.tryConsumeRun()).thenReturn(true);
		when(scheduler.run(RunMode.LIVE, "admin"))
			.thenReturn(OutreachRunSummary.notOk(RunMode.LIVE, Instant.now(), OutreachScheduler.REASON_NOT_CONFIGURED));

		mvc.perform(post("/api/crm/outreach/run").param("mode", "live"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.ok").value(false))
			.andExpect(jsonPath("$.reason").value("not_configured"))
			.andExpect(jsonPath("$.planned").doesNotExist());
	}

	@Test
	void invalidModeIsRejected() throws Exception {
		mvc.perform(post("/api/crm/outreach/run").param("mode", "DRY"))
			.andExpect(status().isBadRequest());

		verifyNoInteractions(scheduler);
	}

	@Test
	void runRateLimitAnswersTooManyRequests() throws Exception {
		when(rateLimiter.tryConsumeRun()).thenReturn(false);

		mvc.perform(post("/api/crm/outreach/run").param("mode", "LIVE"))
			.andExpect(status().isTooManyRequests());

		verifyNoInteractions(scheduler);
	}

	@Test
	void manualTriggerMapsReasonsToStatus() throws Exception {
		when(rateLimiter.tryConsumeManualTrigger()).thenReturn(true);
		when(scheduler.runForLead("LD-1")).thenReturn(
			ManualOutreachResult.dispatched(DispatchOutcome.SENT, "L1", "crm_outreach:quote_followup:L1:quote_followup_1"));
		when(scheduler.runForLead("ghost")).thenReturn(ManualOutreachResult.rejected(ManualOutreachReason.LEAD_NOT_FOUND, null));

		mvc.perform(post("/api/crm/outreach/leads/LD-1/run"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.sent").value(true))
			.andExpect(jsonPath("$.reason").value("sent"))
			.andExpect(jsonPath("$.leadId").value("L1"));
		mvc.perform(post("/api/crm/outreach/leads/ghost/run"))
			.andExpect(status().isNotFound())
			.andExpect(jsonPath("$.reason").value("lead_not_found"));
	}

	@Test
	void manualTriggerRateLimited() throws Exception {
		when(rateLimiter.tryConsumeManualTrigger()).thenReturn(false);

		mvc.perform(post("/api/crm/outreach/leads/LD-1/run"))
			.andExpect(status().isTooManyRequests());

		verify(scheduler, never()).runForLead(anyString());
	}

	@Test
	void dashboardAndRunLookup() throws Exception {
		when(dashboardProjector.project()).thenReturn(OutreachDashboard.empty());
		when(runRepository.findRun("run-1")).thenReturn(Map.of("run_id", "run-1", "status", "COMPLETED"));
		when(runRepository.findRun(eq("missing"))).thenReturn(null);

		mvc.perform(get("/api/crm/outreach/dashboard"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.summary.scheduled").value(0));
		mvc.perform(get("/api/crm/outreach/runs/run-1"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.status").value("COMPLETED"));
		mvc.perform(get("/api/crm/outreach/runs/missing"))
			.andExpect(status().isNotFound());
	}
}
