package io.clubone.outreach.outreach.crm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clubone.outreach.outreach.model.Booking;
import io.clubone.outreach.outreach.model.Lead;
import io.clubone.outreach.outreach.model.Payment;
import io.clubone.outreach.repo.SafeJdbc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to the upstream CRM tables plus the single write-back of lead outreach bookkeeping.
 * Each read is independent: a failing collection degrades to an empty list.
 */
@Repository
public class CrmRepository {

	private static final Logger log = LoggerFactory.getLogger(CrmRepository.class);

	private static final String LEAD_COLUMNS =
			"id, lead_code, status, destination_city, destination_country, travel_start_date, travel_end_date, " +
			"customer_name, customer_email, customer_phone, budget, metadata, updated_at, created_at";

	private final SafeJdbc db;
	private final ObjectMapper objectMapper;
	private final LeadRowMapper leadMapper;
	private final BookingRowMapper bookingMapper = new BookingRowMapper();
	private final PaymentRowMapper paymentMapper;

	public CrmRepository(SafeJdbc db, ObjectMapper objectMapper) {
		this.db = db;
		this.objectMapper = objectMapper;
		this.leadMapper = new LeadRowMapper(objectMapper);
		this.paymentMapper = new PaymentRowMapper(objectMapper);
	}

	public List<Lead> loadLeads(int limit) {
		return db.selectMany("leads",
			"SELECT " + LEAD_COLUMNS + " FROM leads ORDER BY updated_at DESC LIMIT ?",
			leadMapper, limit);
	}

	/**
	 * Resolves a lead by id or lead code.
	 */
	public Optional<Lead> findLead(String leadRef) {
		List<Lead> rows = db.selectMany("leads",
			"SELECT " + LEAD_COLUMNS + " FROM leads WHERE id = ? OR lead_code = ? LIMIT 2",
			leadMapper, leadRef, leadRef);
		return rows.stream().findFirst();
	}

	public List<Booking> loadBookingsForLeads(Collection<String> leadIds, int limit) {
		if (leadIds == null || leadIds.isEmpty()) {
			return List.of();
		}
		List<Object> args = new ArrayList<>(leadIds);
		args.add(limit);
		return db.selectMany("bookings",
			"SELECT id, booking_code, lead_id, payment_status FROM bookings " +
			"WHERE lead_id IN (" + placeholders(leadIds.size()) + ") ORDER BY created_at DESC LIMIT ?",
			bookingMapper, args.toArray());
	}

	/**
	 * Payments still awaiting completion, created at or after {@code since}.
	 */
	public List<Payment> loadPendingPayments(Instant since, int limit) {
		List<Object> args = new ArrayList<>(Payment.PENDING_STATUSES);
		args.add(SafeJdbc.timestamp(since));
		args.add(limit);
		return db.selectMany("payments",
			"SELECT id, booking_id, status, raw_payload, created_at FROM payments " +
			"WHERE status IN (" + placeholders(Payment.PENDING_STATUSES.size()) + ") AND created_at >= ? " +
			"ORDER BY created_at DESC LIMIT ?",
			paymentMapper, args.toArray());
	}

	/**
	 * Writes outreach_count + 1 and last_outreach_at into the lead metadata.
	 * @return false when the write did not land
	 */
	public boolean recordOutreach(Lead lead, Instant sentAt) {
		Map<String, Object> next = new LinkedHashMap<>(lead.getMetadata());
		next.put("outreach_count", lead.getOutreachCount() + 1);
		next.put("last_outreach_at", sentAt.toString());
		String json;
		try {
			json = objectMapper.writeValueAsString(next);
		} catch (JsonProcessingException e) {
			log.warn("Failed to serialize lead metadata: leadId={} error={}", lead.getId(), e.getMessage());
			return false;
		}
		return db.update("leads", "UPDATE leads SET metadata = ? WHERE id = ?", json, lead.getId()) > 0;
	}

	private static String placeholders(int n) {
		return String.join(", ", Collections.nCopies(n, "?"));
	}
}
