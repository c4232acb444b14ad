package io.clubone.outreach.outreach.crm;

import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.model.Booking;
import io.clubone.outreach.outreach.model.Lead;
import io.clubone.outreach.outreach.model.Payment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class CrmSnapshotLoader {

	private static final Logger log = LoggerFactory.getLogger(CrmSnapshotLoader.class);

	private final CrmRepository crm;
	private final OutreachProperties props;

	public CrmSnapshotLoader(CrmRepository crm, OutreachProperties props) {
		this.crm = crm;
		this.props = props;
	}

	public CrmSnapshot load(Instant now) {
		List<Lead> leads = crm.loadLeads(props.getLeadLoadLimit());
		return forLeads(leads, now);
	}

	public CrmSnapshot forLeads(List<Lead> leads, Instant now) {
		List<String> leadIds = leads.stream().map(Lead::getId).collect(Collectors.toList());
		List<Booking> bookings = crm.loadBookingsForLeads(leadIds, props.getBookingLoadLimit());
		List<Payment> payments = crm.loadPendingPayments(now.minus(props.getPaymentLookback()), props.getPaymentLoadLimit());
		log.debug("CRM snapshot loaded: leads={} bookings={} pendingPayments={}", leads.size(), bookings.size(), payments.size());
		return new CrmSnapshot(leads, bookings, payments);
	}
}
