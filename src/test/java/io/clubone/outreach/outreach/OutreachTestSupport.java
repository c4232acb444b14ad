package io.clubone.outreach.outreach;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.clubone.outreach.outreach.model.Lead;
import io.clubone.outreach.outreach.model.LeadStage;
import io.clubone.outreach.outreach.model.OutreachStep;
import org.h2.jdbcx.JdbcDataSource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Shared fixtures: an H2 database carrying the production schema, a settable clock and CRM rows.
 */
public final class OutreachTestSupport {

	public static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

	private OutreachTestSupport() {
	}

	public static JdbcTemplate newDatabase() {
		JdbcDataSource dataSource = new JdbcDataSource();
		dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
		new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
		return new JdbcTemplate(dataSource);
	}

	public static OutreachProperties properties() {
		OutreachProperties props = new OutreachProperties();
		for (OutreachStep step : OutreachStep.values()) {
			props.getTemplates().put(step.getCode(), "tpl_" + step.getCode());
		}
		return props;
	}

	public static ObjectMapper objectMapper() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		return mapper;
	}

	public static Lead lead(String id, LeadStage stage, Instant updatedAt) {
		Lead lead = new Lead();
		lead.setId(id);
		lead.setLeadCode("LD-" + id);
		lead.setStage(stage);
		lead.setCustomerName("Asha Rao");
		lead.setCustomerPhone("+919800000001");
		lead.setDestination("Bali, Indonesia");
		lead.setCreatedAt(updatedAt.minus(Duration.ofDays(1)));
		lead.setUpdatedAt(updatedAt);
		return lead;
	}

	public static void insertLead(JdbcTemplate jdbc, String id, String pipelineStage, String phone, String email,
			Instant updatedAt) {
		insertLead(jdbc, id, pipelineStage, phone, email, updatedAt, Map.of());
	}

	public static void insertLead(JdbcTemplate jdbc, String id, String pipelineStage, String phone, String email,
			Instant updatedAt, Map<String, Object> extraMetadata) {
		Map<String, Object> metadata = new LinkedHashMap<>(extraMetadata);
		metadata.put("pipeline_stage", pipelineStage);
		String json;
		try {
			json = objectMapper().writeValueAsString(metadata);
		} catch (Exception e) {
			throw new IllegalStateException(e);
		}
		jdbc.update("INSERT INTO leads (id, lead_code, status, customer_name, customer_email, customer_phone, " +
				"destination_city, destination_country, travel_start_date, travel_end_date, metadata, created_at, updated_at) " +
				"VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
			id, "LD-" + id, "lead_created", "Asha Rao", email, phone, "Bali", "Indonesia", "2026-05-01", "2026-05-08",
			json, Timestamp.from(updatedAt.minus(Duration.ofDays(1))), Timestamp.from(updatedAt));
	}

	public static void insertBooking(JdbcTemplate jdbc, String id, String leadId, String paymentStatus) {
		jdbc.update("INSERT INTO bookings (id, booking_code, lead_id, payment_status, created_at) VALUES (?, ?, ?, ?, ?)",
			id, "BK-" + id, leadId, paymentStatus, Timestamp.from(NOW.minus(Duration.ofDays(1))));
	}

	public static void insertPayment(JdbcTemplate jdbc, String id, String bookingId, String status, Instant createdAt) {
		jdbc.update("INSERT INTO payments (id, booking_id, status, raw_payload, created_at) VALUES (?, ?, ?, ?, ?)",
			id, bookingId, status, "{\"short_url\":\"https://pay.example/" + id + "\"}", Timestamp.from(createdAt));
	}

	public static int count(JdbcTemplate jdbc, String sql, Object... args) {
		Integer n = jdbc.queryForObject(sql, Integer.class, args);
		return n != null ? n : 0;
	}

	/**
	 * Clock that tests can move forward between runs.
	 */
	public static final class MutableClock extends Clock {

		private Instant instant;

		public MutableClock(Instant instant) {
			this.instant = instant;
		}

		public void advance(Duration duration) {
			instant = instant.plus(duration);
		}

		public void set(Instant instant) {
			this.instant = instant;
		}

		@Override
		public ZoneId getZone() {
			return ZoneOffset.UTC;
		}

		@Override
		public Clock withZone(ZoneId zone) {
			return this;
		}

		@Override
		public Instant instant() {
			return instant;
		}
	}
}
