package io.clubone.outreach.outreach.model;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class Lead {
	private String id;
	private String leadCode;
	private String status;
	private LeadStage stage;
	private String customerName;
	private String customerEmail;
	private String customerPhone;   // sanitized, null when unusable
	private String destination;
	private String travelStart;
	private String travelEnd;
	private BigDecimal budget;
	private Instant createdAt;
	private Instant updatedAt;
	private Map<String, Object> metadata = new LinkedHashMap<>();
	private boolean doNotContact;
	private int outreachCount;
	private Instant lastOutreachAt;

	/**
	 * Base timestamp for lead-driven steps.
	 */
	public Instant getBaseTimestamp() {
		return updatedAt != null ? updatedAt : createdAt;
	}
}
