package io.clubone.outreach.outreach;

/**
 * LIVE reserves and dispatches. MOCK only reports what a LIVE run would dispatch.
 */
public enum RunMode {
	LIVE,
	MOCK
}
