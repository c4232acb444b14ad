package io.clubone.outreach.outreach.model;

public enum DispatchOutcome {
	SENT,
	SKIPPED,
	FAILED
}
