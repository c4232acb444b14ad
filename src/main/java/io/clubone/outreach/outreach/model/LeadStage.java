package io.clubone.outreach.outreach.model;

/**
 * Sales pipeline stages. Codes match the CRM's lowercase values.
 */
public enum LeadStage {
	NEW("new"),
	QUALIFIED("qualified"),
	QUOTE_SENT("quote_sent"),
	NEGOTIATION("negotiation"),
	WON("won"),
	LOST("lost");

	private final String code;

	LeadStage(String code) {
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	/**
	 * Won and lost leads are out of the funnel and never contacted.
	 */
	public boolean isClosed() {
		return this == WON || this == LOST;
	}

	@Override
	public String toString() {
		return code;
	}

	/**
	 * @return LeadStage for the code, or null if not a known stage
	 */
	public static LeadStage fromCode(String code) {
		if (code == null) {
			return null;
		}
		for (LeadStage stage : values()) {
			if (stage.code.equalsIgnoreCase(code.trim())) {
				return stage;
			}
		}
		return null;
	}
}
