package io.clubone.outreach.outreach.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OutreachType {
	QUOTE_FOLLOWUP("quote_followup"),
	PAYMENT_REMINDER("payment_reminder"),
	REENGAGEMENT("reengagement");

	private final String code;

	OutreachType(String code) {
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

	public static OutreachType fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (OutreachType type : values()) {
			if (type.code.equals(code)) {
				return type;
			}
		}
		return null;
	}
}
