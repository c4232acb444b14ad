package io.clubone.outreach.outreach.ledger;

import io.clubone.outreach.outreach.RunMode;
import io.clubone.outreach.outreach.model.DispatchOutcome;
import io.clubone.outreach.outreach.model.Opportunity;
import io.clubone.outreach.outreach.model.OutreachRunSummary;
import io.clubone.outreach.outreach.model.StepState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one run, threaded through selection and dispatch.
 * Runs are sequential, so no synchronization.
 */
public class OutreachRunContext {

	private final String runId;
	private final RunMode mode;
	private final Instant now;
	private final OutreachLedger ledger;
	private final Set<String> claimedKeys = new HashSet<>();
	private final Map<String, Integer> sentThisRun = new HashMap<>();
	private final List<String> planned = new ArrayList<>();
	private int processed;
	private int sent;
	private int skipped;
	private int failed;

	public OutreachRunContext(String runId, RunMode mode, Instant now, OutreachLedger ledger) {
		this.runId = runId;
		this.mode = mode;
		this.now = now;
		this.ledger = ledger;
	}

	public StepState state(Opportunity opportunity) {
		if (claimedKeys.contains(opportunity.getDedupKey())) {
			return StepState.BLOCKED;
		}
		return ledger.state(opportunity.getDedupKey(), now);
	}

	public boolean isHandled(Opportunity opportunity) {
		return state(opportunity) != StepState.OPEN;
	}

	/**
	 * Sends inside the throttle window plus the ones made by this run.
	 */
	public int sentCount(String leadId) {
		return ledger.sentCount(leadId) + sentThisRun.getOrDefault(leadId, 0);
	}

	/**
	 * Attempt number of the next dispatch of this key, starting at 1.
	 */
	public int nextAttempt(Opportunity opportunity) {
		return ledger.failedCount(opportunity.getDedupKey()) + 1;
	}

	/**
	 * Claim number for reserving this key, taken from the log as read at run start.
	 */
	public int nextClaim(Opportunity opportunity) {
		return ledger.nextClaim(opportunity.getDedupKey());
	}

	public void claim(Opportunity opportunity) {
		claimedKeys.add(opportunity.getDedupKey());
	}

	public void plan(Opportunity opportunity) {
		claimedKeys.add(opportunity.getDedupKey());
		planned.add(opportunity.getDedupKey());
		processed++;
	}

	public void recordSkipped() {
		processed++;
		skipped++;
	}

	public void record(Opportunity opportunity, DispatchOutcome outcome) {
		processed++;
		switch (outcome) {
			case SENT:
				sent++;
				sentThisRun.merge(opportunity.getLead().getId(), 1, Integer::sum);
				break;
			case FAILED:
				failed++;
				break;
			default:
				skipped++;
				break;
		}
	}

	public OutreachRunSummary toSummary() {
		OutreachRunSummary summary = new OutreachRunSummary();
		summary.setOk(true);
		summary.setRunId(runId);
		summary.setMode(mode);
		summary.setRunAt(now);
		summary.setProcessed(processed);
		summary.setSent(sent);
		summary.setSkipped(skipped);
		summary.setFailed(failed);
		summary.setPlanned(new ArrayList<>(planned));
		return summary;
	}

	public String getRunId() {
		return runId;
	}

	public RunMode getMode() {
		return mode;
	}

	public Instant getNow() {
		return now;
	}

	public OutreachLedger getLedger() {
		return ledger;
	}

	public int getProcessed() {
		return processed;
	}
}
