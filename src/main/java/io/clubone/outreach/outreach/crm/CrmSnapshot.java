package io.clubone.outreach.outreach.crm;

import io.clubone.outreach.outreach.model.Booking;
import io.clubone.outreach.outreach.model.Lead;
import io.clubone.outreach.outreach.model.Payment;

import java.util.List;

/**
 * Leads, their bookings and recent pending payments, as read at the start of a run.
 */
public class CrmSnapshot {
	private final List<Lead> leads;
	private final List<Booking> bookings;
	private final List<Payment> payments;

	public CrmSnapshot(List<Lead> leads, List<Booking> bookings, List<Payment> payments) {
		this.leads = List.copyOf(leads);
		this.bookings = List.copyOf(bookings);
		this.payments = List.copyOf(payments);
	}

	public List<Lead> getLeads() {
		return leads;
	}

	public List<Booking> getBookings() {
		return bookings;
	}

	public List<Payment> getPayments() {
		return payments;
	}
}
