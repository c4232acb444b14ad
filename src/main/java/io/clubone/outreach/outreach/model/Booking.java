package io.clubone.outreach.outreach.model;

import lombok.Data;

import java.util.Set;

@Data
public class Booking {
	private static final Set<String> PAID_STATUSES = Set.of("paid", "captured", "success");

	private String id;
	private String bookingCode;
	private String leadId;
	private String paymentStatus;

	public boolean isPaid() {
		return paymentStatus != null && PAID_STATUSES.contains(paymentStatus.trim().toLowerCase());
	}

	public String getDisplayRef() {
		return bookingCode != null ? bookingCode : id;
	}
}
