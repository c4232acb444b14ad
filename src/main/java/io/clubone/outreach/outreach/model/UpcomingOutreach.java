package io.clubone.outreach.outreach.model;

import lombok.Data;

import java.time.Instant;

@Data
public class UpcomingOutreach {
	private String leadId;
	private String leadCode;
	private String customerName;
	private String customerPhone;
	private String destination;
	private OutreachType type;
	private OutreachStep step;
	private String template;
	private Instant dueAt;
	private String bookingId;
	private String paymentLink;

	public static UpcomingOutreach from(Opportunity opportunity) {
		Lead lead = opportunity.getLead();
		UpcomingOutreach item = new UpcomingOutreach();
		item.setLeadId(lead.getId());
		item.setLeadCode(lead.getLeadCode());
		item.setCustomerName(lead.getCustomerName());
		item.setCustomerPhone(lead.getCustomerPhone());
		item.setDestination(lead.getDestination());
		item.setType(opportunity.getType());
		item.setStep(opportunity.getStep());
		item.setTemplate(opportunity.getTemplate());
		item.setDueAt(opportunity.getDueAt());
		item.setBookingId(opportunity.getBooking() != null ? opportunity.getBooking().getDisplayRef() : null);
		item.setPaymentLink(opportunity.getPayment() != null ? opportunity.getPayment().getPaymentLink() : null);
		return item;
	}
}
