package io.clubone.outreach.outreach.crm;

import io.clubone.outreach.outreach.OutreachTestSupport;
import io.clubone.outreach.outreach.model.Lead;
import io.clubone.outreach.outreach.model.LeadStage;
import io.clubone.outreach.outreach.model.Payment;
import io.clubone.outreach.repo.SafeJdbc;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.clubone.outreach.outreach.OutreachTestSupport.NOW;
import static io.clubone.outreach.outreach.OutreachTestSupport.insertBooking;
import static io.clubone.outreach.outreach.OutreachTestSupport.insertLead;
import static io.clubone.outreach.outreach.OutreachTestSupport.insertPayment;
import static org.junit.jupiter.api.Assertions.*;

class CrmRepositoryTest {

	private JdbcTemplate jdbc;
	private CrmRepository crm;

	@BeforeEach
	void setUp() {
		jdbc = OutreachTestSupport.newDatabase();
		crm = new CrmRepository(new SafeJdbc(jdbc), OutreachTestSupport.objectMapper());
	}

	@Test
	void mapsLeadColumnsAndMetadata() {
		insertLead(jdbc, "L1", "quote_sent", " +91 (980) 000-0001 ", "Asha@Example.COM", NOW.minus(Duration.ofHours(3)),
			Map.of("outreach_count", 2, "last_outreach_at", "2026-03-09T08:00:00Z", "customer_name", "Asha R."));

		Lead lead = crm.findLead("LD-L1").orElseThrow();

		assertEquals("L1", lead.getId());
		assertEquals(LeadStage.QUOTE_SENT, lead.getStage());
		assertEquals("+919800000001", lead.getCustomerPhone());
		assertEquals("asha@example.com", lead.getCustomerEmail());
		assertEquals("Asha R.", lead.getCustomerName());
		assertEquals("Bali, Indonesia", lead.getDestination());
		assertEquals(2, lead.getOutreachCount());
		assertEquals(NOW.minus(Duration.ofHours(3)), lead.getBaseTimestamp());
		assertFalse(lead.isDoNotContact());
	}

	@Test
	void unreadableMetadataIsTreatedAsEmpty() {
		jdbc.update("INSERT INTO leads (id, status, metadata, updated_at) VALUES (?, ?, ?, ?)",
			"L2", "quotation_sent", "{not json", Timestamp.from(NOW));

		Lead lead = crm.findLead("L2").orElseThrow();

		assertEquals(LeadStage.QUOTE_SENT, lead.getStage());
		assertTrue(lead.getMetadata().isEmpty());
		assertNull(lead.getCustomerPhone());
	}

	@Test
	void stageFallsBackToLegacyStatus() {
		assertEquals(LeadStage.NEW, LeadRowMapper.parseStage(null, Map.of()));
		assertEquals(LeadStage.NEW, LeadRowMapper.parseStage("lead_created", Map.of()));
		assertEquals(LeadStage.QUOTE_SENT, LeadRowMapper.parseStage("Quotation_Sent", Map.of()));
		assertEquals(LeadStage.WON, LeadRowMapper.parseStage("quotation_sent", Map.of("pipeline_stage", "won")));
		assertNull(LeadRowMapper.parseStage("archived", Map.of()));
	}

	@Test
	void pendingPaymentsRespectLookbackAndStatus() {
		insertLead(jdbc, "L1", "new", "+919800000001", null, NOW);
		insertBooking(jdbc, "B1", "L1", "pending");
		insertPayment(jdbc, "P1", "B1", "created", NOW.minus(Duration.ofHours(1)));
		insertPayment(jdbc, "P2", "B1", "captured", NOW.minus(Duration.ofHours(1)));
		insertPayment(jdbc, "P3", "B1", "pending", NOW.minus(Duration.ofDays(5)));

		List<Payment> pending = crm.loadPendingPayments(NOW.minus(Duration.ofDays(4)), 10);

		assertEquals(1, pending.size());
		assertEquals("P1", pending.get(0).getId());
		assertEquals("https://pay.example/P1", pending.get(0).getPaymentLink());
		assertEquals(1, crm.loadBookingsForLeads(List.of("L1"), 10).size());
		assertTrue(crm.loadBookingsForLeads(List.of(), 10).isEmpty());
	}

	@Test
	void recordOutreachKeepsOtherMetadataAndUpdatedAt() {
		insertLead(jdbc, "L1", "quote_sent", "+919800000001", null, NOW.minus(Duration.ofHours(3)),
			Map.of("source", "web"));
		Lead lead = crm.findLead("L1").orElseThrow();

		assertTrue(crm.recordOutreach(lead, NOW));

		Lead reloaded = crm.findLead("L1").orElseThrow();
		assertEquals(1, reloaded.getOutreachCount());
		assertEquals(NOW, reloaded.getLastOutreachAt());
		assertEquals("web", reloaded.getMetadata().get("source"));
		assertEquals(LeadStage.QUOTE_SENT, reloaded.getStage());
		assertEquals(NOW.minus(Duration.ofHours(3)), reloaded.getUpdatedAt());
	}

	@Test
	void unavailableTablesDegradeToEmpty() {
		jdbc.execute("DROP TABLE leads");

		assertTrue(crm.loadLeads(10).isEmpty());
		assertTrue(crm.findLead("L1").isEmpty());
	}
}
