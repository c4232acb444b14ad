package io.clubone.outreach.outreach.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * Every follow-up step with its drip type and delay from the step's base timestamp.
 * Declaration order within a type is the drip order.
 */
public enum OutreachStep {
	QUOTE_FOLLOWUP_1("quote_followup_1", OutreachType.QUOTE_FOLLOWUP, Duration.ofHours(2)),
	QUOTE_FOLLOWUP_2("quote_followup_2", OutreachType.QUOTE_FOLLOWUP, Duration.ofHours(24)),
	QUOTE_FOLLOWUP_3("quote_followup_3", OutreachType.QUOTE_FOLLOWUP, Duration.ofHours(72)),
	PAYMENT_REMINDER_1("payment_reminder_1", OutreachType.PAYMENT_REMINDER, Duration.ofMinutes(30)),
	PAYMENT_REMINDER_2("payment_reminder_2", OutreachType.PAYMENT_REMINDER, Duration.ofHours(6)),
	PAYMENT_REMINDER_3("payment_reminder_3", OutreachType.PAYMENT_REMINDER, Duration.ofHours(24)),
	REENGAGE_1("reengage_1", OutreachType.REENGAGEMENT, Duration.ofHours(168));

	private final String code;
	private final OutreachType type;
	private final Duration delay;

	OutreachStep(String code, OutreachType type, Duration delay) {
		this.code = code;
		this.type = type;
		this.delay = delay;
	}

	@JsonValue
	public String getCode() {
		return code;
	}

	public OutreachType getType() {
		return type;
	}

	public Duration getDelay() {
		return delay;
	}

	@Override
	public String toString() {
		return code;
	}

	public static OutreachStep fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (OutreachStep step : values()) {
			if (step.code.equals(code)) {
				return step;
			}
		}
		return null;
	}
}
