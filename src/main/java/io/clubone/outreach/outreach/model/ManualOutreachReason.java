package io.clubone.outreach.outreach.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Cause reported back to the admin surface for a single-lead trigger.
 */
public enum ManualOutreachReason {
	SENT("sent"),
	SKIPPED("skipped"),
	NO_ELIGIBLE_STEP("no_eligible_step"),
	DO_NOT_CONTACT("do_not_contact"),
	THROTTLED("throttled"),
	DEDUPED("deduped"),
	DISPATCH_FAILED("dispatch_failed"),
	INVALID_LEAD("invalid_lead"),
	LEAD_NOT_FOUND("lead_not_found"),
	NOT_CONFIGURED("not_configured"),
	NOT_RETRYABLE("not_retryable"),
	MANUAL_OUTREACH_FAILED("manual_outreach_failed");

	private final String code;

	ManualOutreachReason(String code) {
		this.code = code;
	}

	@JsonValue
	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}
}
