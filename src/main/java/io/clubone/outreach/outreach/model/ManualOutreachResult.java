package io.clubone.outreach.outreach.model;

public class ManualOutreachResult {
	private final boolean ok;
	private final DispatchOutcome outcome;
	private final ManualOutreachReason reason;
	private final String leadId;
	private final String dedupKey;

	public ManualOutreachResult(boolean ok, DispatchOutcome outcome, ManualOutreachReason reason,
			String leadId, String dedupKey) {
		this.ok = ok;
		this.outcome = outcome;
		this.reason = reason;
		this.leadId = leadId;
		this.dedupKey = dedupKey;
	}

	public static ManualOutreachResult skipped(ManualOutreachReason reason, String leadId, String dedupKey) {
		return new ManualOutreachResult(true, DispatchOutcome.SKIPPED, reason, leadId, dedupKey);
	}

	public static ManualOutreachResult rejected(ManualOutreachReason reason, String leadId) {
		return new ManualOutreachResult(false, DispatchOutcome.SKIPPED, reason, leadId, null);
	}

	public static ManualOutreachResult dispatched(DispatchOutcome outcome, String leadId, String dedupKey) {
		ManualOutreachReason reason = switch (outcome) {
			case SENT -> ManualOutreachReason.SENT;
			case FAILED -> ManualOutreachReason.DISPATCH_FAILED;
			case SKIPPED -> ManualOutreachReason.SKIPPED;
		};
		return new ManualOutreachResult(true, outcome, reason, leadId, dedupKey);
	}

	public boolean isOk() {
		return ok;
	}

	public DispatchOutcome getOutcome() {
		return outcome;
	}

	public boolean isSent() {
		return outcome == DispatchOutcome.SENT;
	}

	public boolean isSkipped() {
		return outcome == DispatchOutcome.SKIPPED;
	}

	public boolean isFailed() {
		return outcome == DispatchOutcome.FAILED;
	}

	public ManualOutreachReason getReason() {
		return reason;
	}

	public String getLeadId() {
		return leadId;
	}

	public String getDedupKey() {
		return dedupKey;
	}
}
