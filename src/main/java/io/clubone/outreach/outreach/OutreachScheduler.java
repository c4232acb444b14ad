package io.clubone.outreach.outreach;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clubone.outreach.outreach.audit.AuditService;
import io.clubone.outreach.outreach.crm.CrmRepository;
import io.clubone.outreach.outreach.crm.CrmSnapshot;
import io.clubone.outreach.outreach.crm.CrmSnapshotLoader;
import io.clubone.outreach.outreach.dispatch.OutreachDispatcher;
import io.clubone.outreach.outreach.exception.DataStoreUnavailableException;
import io.clubone.outreach.outreach.exception.OutreachProcessingException;
import io.clubone.outreach.outreach.failure.AutomationFailureRecorder;
import io.clubone.outreach.outreach.ledger.OutreachLedger;
import io.clubone.outreach.outreach.ledger.OutreachLedgerReader;
import io.clubone.outreach.outreach.ledger.OutreachLogRepository;
import io.clubone.outreach.outreach.ledger.OutreachRunContext;
import io.clubone.outreach.outreach.ledger.ReservationResult;
import io.clubone.outreach.outreach.ledger.ThrottlePolicy;
import io.clubone.outreach.outreach.metrics.OutreachMetrics;
import io.clubone.outreach.outreach.model.DispatchOutcome;
import io.clubone.outreach.outreach.model.Lead;
import io.clubone.outreach.outreach.model.ManualOutreachReason;
import io.clubone.outreach.outreach.model.ManualOutreachResult;
import io.clubone.outreach.outreach.model.Opportunity;
import io.clubone.outreach.outreach.model.OutreachEvent;
import io.clubone.outreach.outreach.model.OutreachLogEntry;
import io.clubone.outreach.outreach.model.OutreachRunStatus;
import io.clubone.outreach.outreach.model.OutreachRunSummary;
import io.clubone.outreach.outreach.model.OutreachStep;
import io.clubone.outreach.outreach.provider.ProviderFactory;
import io.clubone.outreach.outreach.rules.OpportunityGenerator;
import io.clubone.outreach.outreach.rules.OpportunitySelector;
import io.clubone.outreach.outreach.util.LoggingUtils;
import io.clubone.outreach.repo.OutreachRunRepository;
import io.clubone.outreach.repo.SafeJdbc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Periodic outreach run and the single-lead trigger.
 *
 * <p>A run reads the CRM snapshot and the outreach ledger once, selects the due opportunities and
 * processes them one at a time, at most {@code maxMessagesPerRun}. Each dispatch is preceded by an
 * atomic reservation on the outreach log, so a concurrent run can never send the same step twice.
 * The reservation claims the number the ledger read implies; a writer whose read has gone stale
 * finds that number taken and backs off.
 */
@Service
public class OutreachScheduler {

	private static final Logger log = LoggerFactory.getLogger(OutreachScheduler.class);

	public static final String REASON_NOT_CONFIGURED = "not_configured";
	public static final String REASON_DATA_STORE_UNAVAILABLE = "data_store_unavailable";
	public static final String REASON_RUN_FAILED = "run_failed";

	private final OutreachProperties props;
	private final SafeJdbc db;
	private final CrmRepository crm;
	private final CrmSnapshotLoader snapshotLoader;
	private final OpportunityGenerator generator;
	private final OpportunitySelector selector;
	private final OutreachLedgerReader ledgerReader;
	private final OutreachLogRepository logRepository;
	private final ThrottlePolicy throttle;
	private final OutreachDispatcher dispatcher;
	private final AutomationFailureRecorder failureRecorder;
	private final ProviderFactory providers;
	private final OutreachRunRepository runRepository;
	private final AuditService auditService;
	private final OutreachMetrics metrics;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	public OutreachScheduler(OutreachProperties props, SafeJdbc db, CrmRepository crm, CrmSnapshotLoader snapshotLoader,
			OpportunityGenerator generator, OpportunitySelector selector, OutreachLedgerReader ledgerReader,
			OutreachLogRepository logRepository, ThrottlePolicy throttle, OutreachDispatcher dispatcher,
			AutomationFailureRecorder failureRecorder, ProviderFactory providers, OutreachRunRepository runRepository,
			AuditService auditService, OutreachMetrics metrics, ObjectMapper objectMapper, Clock clock) {
		this.props = props;
		this.db = db;
		this.crm = crm;
		this.snapshotLoader = snapshotLoader;
		this.generator = generator;
		this.selector = selector;
		this.ledgerReader = ledgerReader;
		this.logRepository = logRepository;
		this.throttle = throttle;
		this.dispatcher = dispatcher;
		this.failureRecorder = failureRecorder;
		this.providers = providers;
		this.runRepository = runRepository;
		this.auditService = auditService;
		this.metrics = metrics;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	public OutreachRunSummary run(RunMode mode, String triggerSource) {
		Instant now = Instant.now(clock);
		LoggingUtils.ensureCorrelationId();
		try {
			if (!providers.isChannelConfigured()) {
				log.info("Outreach run skipped, channel provider not configured: mode={} trigger={}", mode, triggerSource);
				return OutreachRunSummary.notOk(mode, now, REASON_NOT_CONFIGURED);
			}
			try {
				db.probe();
			} catch (DataStoreUnavailableException e) {
				log.warn("Outreach run skipped, data store unavailable: mode={} error={}", mode, e.getMessage());
				return OutreachRunSummary.notOk(mode, now, REASON_DATA_STORE_UNAVAILABLE);
			}
			return execute(mode, triggerSource, now);
		} finally {
			LoggingUtils.clearContext();
		}
	}

	private OutreachRunSummary execute(RunMode mode, String triggerSource, Instant now) {
		String runId = runRepository.createRun(mode, triggerSource, now);
		LoggingUtils.setRunId(runId);
		auditService.logRunStarted(runId, mode.name(), triggerSource);
		var timer = metrics.startRunTimer();
		log.info("Outreach run started: runId={} mode={} trigger={} runAt={}", runId, mode, triggerSource, now);

		try {
			CrmSnapshot snapshot = snapshotLoader.load(now);
			OutreachLedger ledger = ledgerReader.read(now);
			OutreachRunContext context = new OutreachRunContext(runId, mode, now, ledger);

			if (mode == RunMode.LIVE) {
				recordOrphanedReservations(ledger, now);
			}

			List<Opportunity> candidates = generator.generate(snapshot.getLeads(), snapshot.getBookings(), snapshot.getPayments());
			List<Opportunity> due = selector.due(selector.firstEligiblePerType(candidates, context::state), now);
			log.info("Outreach selection: runId={} candidates={} due={} cap={}",
				runId, candidates.size(), due.size(), props.getMaxMessagesPerRun());

			for (Opportunity opportunity : due) {
				if (context.getProcessed() >= props.getMaxMessagesPerRun()) {
					break;
				}
				LoggingUtils.setLeadId(opportunity.getLead().getId());
				try {
					process(opportunity, context);
				} catch (RuntimeException e) {
					OutreachProcessingException failure = new OutreachProcessingException(
						"Outreach processing failed: " + e.getMessage(), opportunity.getLead().getId(), runId,
						opportunity.getDedupKey(), e);
					LoggingUtils.logError(log, failure.getMessage(), failure.getLeadId(), runId, failure);
					context.record(opportunity, DispatchOutcome.FAILED);
				}
			}
			LoggingUtils.setLeadId(null);

			OutreachRunSummary summary = context.toSummary();
			Map<String, Object> summaryMap = summaryMap(summary);
			runRepository.completeRun(runId, OutreachRunStatus.COMPLETED, toJson(summaryMap), Instant.now(clock));
			auditService.logRunCompleted(runId, summaryMap, triggerSource);
			log.info("Outreach run completed: runId={} mode={} processed={} sent={} skipped={} failed={}",
				runId, mode, summary.getProcessed(), summary.getSent(), summary.getSkipped(), summary.getFailed());
			return summary;
		} catch (RuntimeException e) {
			LoggingUtils.logError(log, "Outreach run failed", null, runId, e);
			runRepository.completeRun(runId, OutreachRunStatus.FAILED, null, Instant.now(clock));
			auditService.logRunFailed(runId, e.getMessage(), triggerSource);
			OutreachRunSummary summary = OutreachRunSummary.notOk(mode, now, REASON_RUN_FAILED);
			summary.setRunId(runId);
			return summary;
		} finally {
			metrics.recordRunExecutionTime(timer);
		}
	}

	private void process(Opportunity opportunity, OutreachRunContext context) {
		switch (throttle.evaluate(opportunity, context)) {
			case DO_NOT_CONTACT:
				context.recordSkipped();
				metrics.recordSkipped("do_not_contact");
				return;
			case THROTTLED:
				if (context.getMode() == RunMode.LIVE) {
					logRepository.append(throttledEntry(opportunity, context.getNow()));
				}
				context.recordSkipped();
				metrics.recordSkipped("throttled");
				log.info("Outreach throttled: dedupKey={} sentInWindow={}",
					opportunity.getDedupKey(), context.sentCount(opportunity.getLead().getId()));
				return;
			case DEDUPED:
				context.recordSkipped();
				metrics.recordSkipped("deduped");
				return;
			default:
				break;
		}

		if (context.getMode() == RunMode.MOCK) {
			context.plan(opportunity);
			log.info("MOCK outreach planned: dedupKey={} dueAt={}", opportunity.getDedupKey(), opportunity.getDueAt());
			return;
		}

		ReservationResult reservation = logRepository.tryReserve(opportunity, context.nextClaim(opportunity),
			context.getRunId(), context.getNow());
		context.claim(opportunity);
		if (reservation != ReservationResult.RESERVED) {
			context.recordSkipped();
			metrics.recordSkipped(reservation == ReservationResult.CONFLICT ? "deduped" : "reservation_unavailable");
			return;
		}
		DispatchOutcome outcome = dispatcher.dispatch(opportunity, context.nextAttempt(opportunity), context.getRunId());
		context.record(opportunity, outcome);
	}

	/**
	 * Dispatches the earliest eligible step of one lead, ignoring its due time and the run cap.
	 */
	public ManualOutreachResult runForLead(String leadRef) {
		String ref = leadRef != null ? leadRef.trim() : "";
		if (ref.isEmpty()) {
			return ManualOutreachResult.rejected(ManualOutreachReason.INVALID_LEAD, null);
		}
		LoggingUtils.ensureCorrelationId();
		try {
			ManualOutreachResult result = triggerLead(ref);
			auditService.logManualOutreach(ref, result.getReason().getCode(), result.getDedupKey(), "admin");
			log.info("Manual outreach finished: leadRef={} ok={} outcome={} reason={}",
				ref, result.isOk(), result.getOutcome(), result.getReason());
			return result;
		} catch (RuntimeException e) {
			LoggingUtils.logError(log, "Manual outreach failed", ref, null, e);
			return new ManualOutreachResult(false, DispatchOutcome.FAILED, ManualOutreachReason.MANUAL_OUTREACH_FAILED,
				null, null);
		} finally {
			LoggingUtils.clearContext();
		}
	}

	private ManualOutreachResult triggerLead(String ref) {
		if (!providers.isChannelConfigured()) {
			return ManualOutreachResult.rejected(ManualOutreachReason.NOT_CONFIGURED, null);
		}
		try {
			db.probe();
		} catch (DataStoreUnavailableException e) {
			log.warn("Manual outreach skipped, data store unavailable: error={}", e.getMessage());
			return ManualOutreachResult.rejected(ManualOutreachReason.NOT_CONFIGURED, null);
		}

		Optional<Lead> found = crm.findLead(ref);
		if (found.isEmpty()) {
			return ManualOutreachResult.rejected(ManualOutreachReason.LEAD_NOT_FOUND, null);
		}
		Lead lead = found.get();
		LoggingUtils.setLeadId(lead.getId());
		if (lead.isDoNotContact()) {
			return ManualOutreachResult.skipped(ManualOutreachReason.DO_NOT_CONTACT, lead.getId(), null);
		}

		Instant now = Instant.now(clock);
		CrmSnapshot snapshot = snapshotLoader.forLeads(List.of(lead), now);
		OutreachRunContext context = new OutreachRunContext(null, RunMode.LIVE, now, ledgerReader.read(now));
		List<Opportunity> candidates = generator.generate(snapshot.getLeads(), snapshot.getBookings(), snapshot.getPayments());
		Optional<Opportunity> next = selector.earliest(selector.firstEligiblePerType(candidates, context::state));
		if (next.isEmpty()) {
			return ManualOutreachResult.skipped(ManualOutreachReason.NO_ELIGIBLE_STEP, lead.getId(), null);
		}
		Opportunity opportunity = next.get();

		switch (throttle.evaluate(opportunity, context)) {
			case DO_NOT_CONTACT:
				return ManualOutreachResult.skipped(ManualOutreachReason.DO_NOT_CONTACT, lead.getId(), opportunity.getDedupKey());
			case THROTTLED:
				return ManualOutreachResult.skipped(ManualOutreachReason.THROTTLED, lead.getId(), opportunity.getDedupKey());
			case DEDUPED:
				return ManualOutreachResult.skipped(ManualOutreachReason.DEDUPED, lead.getId(), opportunity.getDedupKey());
			default:
				break;
		}

		return reserveAndDispatch(opportunity, context.nextClaim(opportunity), context.nextAttempt(opportunity), now);
	}

	/**
	 * Operator retry of one failed or orphaned step, named by its dedup key. Backoff is ignored,
	 * the send cap and contact preference are not. An orphaned reservation is released with a
	 * failed entry first, so the ledger stays balanced.
	 */
	public ManualOutreachResult retryStep(String dedupKey) {
		LoggingUtils.ensureCorrelationId();
		try {
			ManualOutreachResult result = retryKey(dedupKey);
			log.info("Outreach step retry finished: dedupKey={} ok={} outcome={} reason={}",
				dedupKey, result.isOk(), result.getOutcome(), result.getReason());
			return result;
		} catch (RuntimeException e) {
			LoggingUtils.logError(log, "Outreach step retry failed", Opportunity.leadIdOf(dedupKey), null, e);
			return new ManualOutreachResult(false, DispatchOutcome.FAILED, ManualOutreachReason.MANUAL_OUTREACH_FAILED,
				null, dedupKey);
		} finally {
			LoggingUtils.clearContext();
		}
	}

	public static boolean isRetryableKey(String dedupKey) {
		return Opportunity.stepOf(dedupKey) != null;
	}

	private ManualOutreachResult retryKey(String dedupKey) {
		OutreachStep step = Opportunity.stepOf(dedupKey);
		if (step == null) {
			return ManualOutreachResult.rejected(ManualOutreachReason.NOT_RETRYABLE, null);
		}
		if (!providers.isChannelConfigured()) {
			return ManualOutreachResult.rejected(ManualOutreachReason.NOT_CONFIGURED, null);
		}
		try {
			db.probe();
		} catch (DataStoreUnavailableException e) {
			log.warn("Outreach step retry skipped, data store unavailable: error={}", e.getMessage());
			return ManualOutreachResult.rejected(ManualOutreachReason.NOT_CONFIGURED, null);
		}

		Optional<Lead> found = crm.findLead(Opportunity.leadIdOf(dedupKey));
		if (found.isEmpty()) {
			return ManualOutreachResult.rejected(ManualOutreachReason.LEAD_NOT_FOUND, null);
		}
		Lead lead = found.get();
		LoggingUtils.setLeadId(lead.getId());
		if (lead.isDoNotContact()) {
			return ManualOutreachResult.skipped(ManualOutreachReason.DO_NOT_CONTACT, lead.getId(), dedupKey);
		}

		Instant now = Instant.now(clock);
		CrmSnapshot snapshot = snapshotLoader.forLeads(List.of(lead), now);
		Optional<Opportunity> match = generator.generate(snapshot.getLeads(), snapshot.getBookings(), snapshot.getPayments())
			.stream()
			.filter(o -> o.getDedupKey().equals(dedupKey))
			.findFirst();
		if (match.isEmpty()) {
			return ManualOutreachResult.skipped(ManualOutreachReason.NO_ELIGIBLE_STEP, lead.getId(), dedupKey);
		}
		Opportunity opportunity = match.get();

		OutreachLedger ledger = ledgerReader.read(now);
		if (ledger.isClosed(dedupKey) || ledger.isPending(dedupKey, now)) {
			return ManualOutreachResult.skipped(ManualOutreachReason.DEDUPED, lead.getId(), dedupKey);
		}
		for (OutreachStep later : OutreachStep.values()) {
			if (later.getType() == step.getType() && later.ordinal() > step.ordinal()
					&& ledger.hasHistory(Opportunity.dedupKey(later.getType(), lead.getId(), later))) {
				log.info("Outreach step retry refused, drip already moved on: dedupKey={} later={}", dedupKey, later.getCode());
				return ManualOutreachResult.rejected(ManualOutreachReason.NOT_RETRYABLE, lead.getId());
			}
		}
		OutreachRunContext context = new OutreachRunContext(null, RunMode.LIVE, now, ledger);
		if (throttle.isOverCap(opportunity, context)) {
			return ManualOutreachResult.skipped(ManualOutreachReason.THROTTLED, lead.getId(), dedupKey);
		}

		int attempt = context.nextAttempt(opportunity);
		if (ledger.isOrphaned(dedupKey, now)) {
			if (!logRepository.append(releasedEntry(opportunity, now))) {
				return ManualOutreachResult.rejected(ManualOutreachReason.MANUAL_OUTREACH_FAILED, lead.getId());
			}
			attempt++;
		}
		return reserveAndDispatch(opportunity, context.nextClaim(opportunity), attempt, now);
	}

	private ManualOutreachResult reserveAndDispatch(Opportunity opportunity, int claimSeq, int attempt, Instant now) {
		String leadId = opportunity.getLead().getId();
		ReservationResult reservation = logRepository.tryReserve(opportunity, claimSeq, null, now);
		if (reservation == ReservationResult.CONFLICT) {
			return ManualOutreachResult.skipped(ManualOutreachReason.DEDUPED, leadId, opportunity.getDedupKey());
		}
		if (reservation == ReservationResult.UNAVAILABLE) {
			return ManualOutreachResult.rejected(ManualOutreachReason.MANUAL_OUTREACH_FAILED, leadId);
		}
		DispatchOutcome outcome = dispatcher.dispatch(opportunity, attempt, null);
		return ManualOutreachResult.dispatched(outcome, leadId, opportunity.getDedupKey());
	}

	/**
	 * Raises one automation failure per orphaned reservation. A failure already raised for the
	 * same reservation, open or resolved, is not raised again.
	 */
	private void recordOrphanedReservations(OutreachLedger ledger, Instant now) {
		for (OutreachLedger.OrphanedReservation orphan : ledger.orphanedReservations(now)) {
			if (failureRecorder.hasRecordSince(orphan.getDedupKey(), orphan.getReservedAt())) {
				continue;
			}
			Map<String, Object> payload = new LinkedHashMap<>();
			payload.put("lead_id", orphan.getLeadId());
			payload.put("reserved_at", orphan.getReservedAt().toString());
			failureRecorder.record(orphan.getLeadId(), null, orphan.getDedupKey(),
				"outreach_reservation_orphaned: no outcome since " + orphan.getReservedAt(),
				ledger.failedCount(orphan.getDedupKey()) + 1, payload);
		}
	}

	private OutreachLogEntry releasedEntry(Opportunity opportunity, Instant now) {
		OutreachLogEntry entry = new OutreachLogEntry();
		entry.setEvent(OutreachEvent.FAILED);
		entry.setLeadId(opportunity.getLead().getId());
		entry.setDedupKey(opportunity.getDedupKey());
		entry.setType(opportunity.getType());
		entry.setStep(opportunity.getStep());
		entry.setMessage("Reservation released by operator retry");
		entry.setCreatedAt(now);
		return entry;
	}

	private OutreachLogEntry throttledEntry(Opportunity opportunity, Instant now) {
		OutreachLogEntry entry = new OutreachLogEntry();
		entry.setEvent(OutreachEvent.SKIPPED);
		entry.setLeadId(opportunity.getLead().getId());
		entry.setDedupKey(opportunity.getDedupKey());
		entry.setType(opportunity.getType());
		entry.setStep(opportunity.getStep());
		entry.setMessage("Outreach skipped due to throttling");
		entry.setCreatedAt(now);
		return entry;
	}

	private static Map<String, Object> summaryMap(OutreachRunSummary summary) {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("mode", summary.getMode() != null ? summary.getMode().name() : null);
		map.put("processed", summary.getProcessed());
		map.put("sent", summary.getSent());
		map.put("skipped", summary.getSkipped());
		map.put("failed", summary.getFailed());
		map.put("planned", summary.getPlanned().size());
		return map;
	}

	private String toJson(Map<String, Object> map) {
		try {
			return objectMapper.writeValueAsString(map);
		} catch (Exception e) {
			log.warn("Failed to serialize run summary: error={}", e.getMessage());
			return null;
		}
	}
}
