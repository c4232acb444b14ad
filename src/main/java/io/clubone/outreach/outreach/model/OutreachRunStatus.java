package io.clubone.outreach.outreach.model;

/**
 * Enumeration of crm_outreach_run.status values.
 */
public enum OutreachRunStatus {
	RUNNING("RUNNING"),
	COMPLETED("COMPLETED"),
	FAILED("FAILED");

	private final String code;

	OutreachRunStatus(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public String toString() {
		return code;
	}
}
