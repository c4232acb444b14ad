package io.clubone.outreach.outreach.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event kinds written to crm_outreach_log.
 * Only the first four make up the idempotency ledger.
 */
public enum OutreachEvent {
	RESERVED("crm_outreach_reserved", "info", true),
	SENT("crm_outreach_sent", "success", true),
	SKIPPED("crm_outreach_skipped", "skipped", true),
	FAILED("crm_outreach_failed", "failed", true),
	TAGGING_FAILED("crm_outreach_tagging_failed", "failed", false),
	BOOKKEEPING_SKIPPED("crm_outreach_meta_skipped", "skipped", false);

	private final String code;
	private final String status;
	private final boolean ledger;

	OutreachEvent(String code, String status, boolean ledger) {
		this.code = code;
		this.status = status;
		this.ledger = ledger;
	}

	@JsonValue
	public String getCode() {
		return code;
	}

	public String getStatus() {
		return status;
	}

	public String getLevel() {
		return "failed".equals(status) ? "error" : "info";
	}

	public boolean isLedgerEvent() {
		return ledger;
	}

	@Override
	public String toString() {
		return code;
	}

	public static OutreachEvent fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (OutreachEvent event : values()) {
			if (event.code.equals(code)) {
				return event;
			}
		}
		return null;
	}
}
