package io.clubone.outreach.outreach.ledger;

/**
 * Outcome of an atomic "insert if absent" on the outreach log.
 */
public enum ReservationResult {
	RESERVED,
	/** Another writer already claimed the step. */
	CONFLICT,
	/** The write did not land for any other reason; the step must not be dispatched. */
	UNAVAILABLE
}
