package io.clubone.outreach.outreach.model;

import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class Payment {
	public static final List<String> PENDING_STATUSES = List.of("created", "pending", "authorized", "requires_action");

	private String id;
	private String bookingId;
	private String status;
	private Instant createdAt;
	private String paymentLink;

	public boolean needsReminder() {
		return status != null && PENDING_STATUSES.contains(status.trim().toLowerCase());
	}
}
