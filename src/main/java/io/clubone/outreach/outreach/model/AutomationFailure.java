package io.clubone.outreach.outreach.model;

import lombok.Data;

import java.time.Instant;

@Data
public class AutomationFailure {
	private String id;
	private String leadId;
	private String bookingId;
	private String event;
	private String status;
	private int attempts;
	private String lastError;
	private String payload;         // JSON
	private Instant createdAt;
	private Instant updatedAt;
}
