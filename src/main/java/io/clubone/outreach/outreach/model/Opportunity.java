package io.clubone.outreach.outreach.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A computed follow-up candidate. Recomputed every run and never persisted.
 */
public final class Opportunity {

	private static final String KEY_PREFIX = "crm_outreach";

	private final OutreachStep step;
	private final String dedupKey;
	private final Instant dueAt;
	private final String template;
	private final Lead lead;
	private final Booking booking;
	private final Payment payment;

	public Opportunity(OutreachStep step, Instant dueAt, String template, Lead lead, Booking booking, Payment payment) {
		this.step = Objects.requireNonNull(step, "step");
		this.dueAt = Objects.requireNonNull(dueAt, "dueAt");
		this.lead = Objects.requireNonNull(lead, "lead");
		this.template = template;
		this.booking = booking;
		this.payment = payment;
		this.dedupKey = dedupKey(step.getType(), lead.getId(), step);
	}

	/**
	 * Deterministic idempotency token for one (type, lead, step). Independent of run time.
	 */
	public static String dedupKey(OutreachType type, String leadId, OutreachStep step) {
		return KEY_PREFIX + ":" + type.getCode() + ":" + leadId + ":" + step.getCode();
	}

	/**
	 * Step named by a dedup key, or null when the key is not an outreach step key.
	 */
	public static OutreachStep stepOf(String dedupKey) {
		String leadId = leadIdOf(dedupKey);
		if (leadId == null) {
			return null;
		}
		OutreachStep step = OutreachStep.fromCode(dedupKey.substring(dedupKey.lastIndexOf(':') + 1));
		return step != null && dedupKey(step.getType(), leadId, step).equals(dedupKey) ? step : null;
	}

	public static String leadIdOf(String dedupKey) {
		if (dedupKey == null || !dedupKey.startsWith(KEY_PREFIX + ":")) {
			return null;
		}
		int typeEnd = dedupKey.indexOf(':', KEY_PREFIX.length() + 1);
		int stepStart = dedupKey.lastIndexOf(':');
		if (typeEnd < 0 || stepStart <= typeEnd + 1) {
			return null;
		}
		return dedupKey.substring(typeEnd + 1, stepStart);
	}

	/**
	 * Event namespace used for this subsystem's automation failures.
	 */
	public static String failureEventPattern() {
		return KEY_PREFIX + ":%";
	}

	public OutreachType getType() {
		return step.getType();
	}

	public OutreachStep getStep() {
		return step;
	}

	public String getDedupKey() {
		return dedupKey;
	}

	public Instant getDueAt() {
		return dueAt;
	}

	/**
	 * @return channel template id, or null when none is configured (skip-only)
	 */
	public String getTemplate() {
		return template;
	}

	public boolean hasTemplate() {
		return template != null && !template.isBlank();
	}

	public Lead getLead() {
		return lead;
	}

	public Booking getBooking() {
		return booking;
	}

	public Payment getPayment() {
		return payment;
	}

	public boolean isDue(Instant now) {
		return !dueAt.isAfter(now);
	}

	@Override
	public String toString() {
		return "Opportunity{" + dedupKey + ", dueAt=" + dueAt + "}";
	}
}
