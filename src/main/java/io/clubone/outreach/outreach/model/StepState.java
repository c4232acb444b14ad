package io.clubone.outreach.outreach.model;

/**
 * Where a drip step stands in the outreach log.
 */
public enum StepState {
	/** No history, or a failed attempt whose backoff has elapsed. */
	OPEN,
	/** In flight, orphaned, or waiting out a backoff. Later steps must wait. */
	BLOCKED,
	/** Sent, skipped, or out of attempts. Later steps may proceed. */
	CLEARED
}
