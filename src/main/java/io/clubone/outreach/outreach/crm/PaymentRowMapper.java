package io.clubone.outreach.outreach.crm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clubone.outreach.outreach.model.Payment;
import io.clubone.outreach.repo.SafeJdbc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

public class PaymentRowMapper implements RowMapper<Payment> {

	private static final Logger log = LoggerFactory.getLogger(PaymentRowMapper.class);

	private static final List<String> LINK_FIELDS = List.of("payment_url", "payment_link_url", "short_url");

	private final ObjectMapper objectMapper;

	public PaymentRowMapper(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public Payment mapRow(ResultSet rs, int rowNum) throws SQLException {
		String id = rs.getString("id");
		if (id == null || id.isBlank()) {
			return null;
		}
		Payment p = new Payment();
		p.setId(id.trim());
		p.setBookingId(blankToNull(rs.getString("booking_id")));
		p.setStatus(blankToNull(rs.getString("status")));
		p.setCreatedAt(SafeJdbc.instant(rs.getTimestamp("created_at")));
		p.setPaymentLink(extractLink(p.getId(), rs.getString("raw_payload")));
		return p;
	}

	String extractLink(String paymentId, String rawPayload) {
		if (rawPayload == null || rawPayload.isBlank()) {
			return null;
		}
		try {
			JsonNode root = objectMapper.readTree(rawPayload);
			for (String field : LINK_FIELDS) {
				JsonNode node = root.path(field);
				if (node.isTextual() && !node.asText().isBlank()) {
					return node.asText().trim();
				}
			}
		} catch (Exception e) {
			log.debug("Payment payload is not JSON: paymentId={} error={}", paymentId, e.getMessage());
		}
		return null;
	}

	private static String blankToNull(String v) {
		return v == null || v.isBlank() ? null : v.trim();
	}
}
