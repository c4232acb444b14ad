package io.clubone.outreach.outreach.crm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clubone.outreach.outreach.model.Lead;
import io.clubone.outreach.outreach.model.LeadStage;
import io.clubone.outreach.outreach.util.ContactSanitizer;
import io.clubone.outreach.repo.SafeJdbc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a leads row. Rows without an id map to null and are dropped by the caller.
 */
public class LeadRowMapper implements RowMapper<Lead> {

	private static final Logger log = LoggerFactory.getLogger(LeadRowMapper.class);

	private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

	private final ObjectMapper objectMapper;

	public LeadRowMapper(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public Lead mapRow(ResultSet rs, int rowNum) throws SQLException {
		String id = trimToNull(rs.getString("id"));
		if (id == null) {
			log.debug("Dropping lead row {} without id", rowNum);
			return null;
		}
		Map<String, Object> metadata = parseMetadata(id, rs.getString("metadata"));

		Lead lead = new Lead();
		lead.setId(id);
		lead.setLeadCode(trimToNull(rs.getString("lead_code")));
		lead.setStatus(trimToNull(rs.getString("status")));
		lead.setStage(parseStage(lead.getStatus(), metadata));
		lead.setCustomerName(firstNonBlank(metadata.get("customer_name"), rs.getString("customer_name")));
		lead.setCustomerEmail(ContactSanitizer.normalizeEmail(
				firstNonBlank(metadata.get("customer_email"), rs.getString("customer_email"))));
		lead.setCustomerPhone(ContactSanitizer.sanitizePhone(
				firstNonBlank(metadata.get("customer_phone"), rs.getString("customer_phone"))));
		lead.setDestination(destination(rs.getString("destination_city"), rs.getString("destination_country")));
		lead.setTravelStart(trimToNull(rs.getString("travel_start_date")));
		lead.setTravelEnd(trimToNull(rs.getString("travel_end_date")));
		lead.setBudget(rs.getBigDecimal("budget"));
		lead.setCreatedAt(SafeJdbc.instant(rs.getTimestamp("created_at")));
		lead.setUpdatedAt(SafeJdbc.instant(rs.getTimestamp("updated_at")));
		lead.setMetadata(metadata);
		lead.setDoNotContact(toBoolean(metadata.get("do_not_contact")));
		lead.setOutreachCount(Math.max(0, toInt(metadata.get("outreach_count"))));
		lead.setLastOutreachAt(toInstant(metadata.get("last_outreach_at")));
		return lead;
	}

	/**
	 * Pipeline stage wins over the legacy status column.
	 */
	static LeadStage parseStage(String status, Map<String, Object> metadata) {
		String pipeline = trimToNull(asString(metadata.get("pipeline_stage")));
		if (pipeline != null) {
			return LeadStage.fromCode(pipeline);
		}
		String s = status != null ? status.trim().toLowerCase() : "";
		if (s.isEmpty() || "lead_created".equals(s)) {
			return LeadStage.NEW;
		}
		if ("quotation_sent".equals(s)) {
			return LeadStage.QUOTE_SENT;
		}
		return LeadStage.fromCode(s);
	}

	private Map<String, Object> parseMetadata(String leadId, String json) {
		if (json == null || json.isBlank()) {
			return new LinkedHashMap<>();
		}
		try {
			Map<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE);
			return parsed != null ? parsed : new LinkedHashMap<>();
		} catch (Exception e) {
			log.warn("Unreadable lead metadata, treating as empty: leadId={} error={}", leadId, e.getMessage());
			return new LinkedHashMap<>();
		}
	}

	private static String destination(String city, String country) {
		String c = trimToNull(city);
		String k = trimToNull(country);
		if (c != null && k != null) {
			return c + ", " + k;
		}
		return c != null ? c : k;
	}

	private static String firstNonBlank(Object preferred, String fallback) {
		String p = trimToNull(asString(preferred));
		return p != null ? p : trimToNull(fallback);
	}

	private static String asString(Object value) {
		return value instanceof String ? (String) value : null;
	}

	private static String trimToNull(String value) {
		if (value == null) {
			return null;
		}
		String t = value.trim();
		return t.isEmpty() ? null : t;
	}

	private static boolean toBoolean(Object value) {
		if (value instanceof Boolean) {
			return (Boolean) value;
		}
		return value instanceof String && "true".equalsIgnoreCase(((String) value).trim());
	}

	private static int toInt(Object value) {
		if (value instanceof Number) {
			return (int) Math.floor(((Number) value).doubleValue());
		}
		if (value instanceof String) {
			try {
				return (int) Math.floor(Double.parseDouble(((String) value).trim()));
			} catch (NumberFormatException e) {
				return 0;
			}
		}
		return 0;
	}

	private static Instant toInstant(Object value) {
		String s = trimToNull(asString(value));
		if (s == null) {
			return null;
		}
		try {
			return Instant.parse(s);
		} catch (DateTimeParseException e) {
			return null;
		}
	}
}
