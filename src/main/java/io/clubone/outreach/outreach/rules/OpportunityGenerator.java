package io.clubone.outreach.outreach.rules;

import io.clubone.outreach.outreach.model.Booking;
import io.clubone.outreach.outreach.model.Lead;
import io.clubone.outreach.outreach.model.Opportunity;
import io.clubone.outreach.outreach.model.OutreachStep;
import io.clubone.outreach.outreach.model.Payment;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes every due or upcoming follow-up from the current CRM snapshot.
 * Stateless given its inputs; the result is unsorted.
 */
@Component
public class OpportunityGenerator {

	private final OutreachRuleTable rules;
	private final TemplateRegistry templates;

	public OpportunityGenerator(OutreachRuleTable rules, TemplateRegistry templates) {
		this.rules = rules;
		this.templates = templates;
	}

	public List<Opportunity> generate(List<Lead> leads, List<Booking> bookings, List<Payment> payments) {
		Map<String, List<Booking>> bookingsByLead = new HashMap<>();
		Map<String, Booking> bookingById = new HashMap<>();
		for (Booking booking : bookings) {
			bookingById.put(booking.getId(), booking);
			if (booking.getLeadId() != null) {
				bookingsByLead.computeIfAbsent(booking.getLeadId(), k -> new ArrayList<>()).add(booking);
			}
		}

		List<Opportunity> out = new ArrayList<>();
		for (Lead lead : leads) {
			if (isExcluded(lead)) {
				continue;
			}
			Instant leadBase = lead.getBaseTimestamp();
			for (OutreachStep step : rules.leadSteps(lead.getStage())) {
				add(out, lead, step, leadBase, null, null);
			}

			List<Booking> leadBookings = bookingsByLead.getOrDefault(lead.getId(), List.of());
			if (leadBookings.isEmpty()) {
				continue;
			}
			for (Payment payment : payments) {
				if (payment.getBookingId() == null || !payment.needsReminder()) {
					continue;
				}
				Booking booking = bookingById.get(payment.getBookingId());
				if (booking == null || !lead.getId().equals(booking.getLeadId()) || booking.isPaid()) {
					continue;
				}
				for (OutreachStep step : rules.paymentSteps()) {
					add(out, lead, step, payment.getCreatedAt(), booking, payment);
				}
			}
		}
		return out;
	}

	/**
	 * Won, lost and do-not-contact leads never produce opportunities.
	 */
	public boolean isExcluded(Lead lead) {
		return lead.isDoNotContact() || (lead.getStage() != null && lead.getStage().isClosed());
	}

	private void add(List<Opportunity> out, Lead lead, OutreachStep step, Instant base, Booking booking, Payment payment) {
		if (base == null) {
			return;
		}
		out.add(new Opportunity(step, rules.dueAt(step, base), templates.resolve(step), lead, booking, payment));
	}
}
