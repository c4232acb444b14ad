package io.clubone.outreach.outreach.ledger;

import io.clubone.outreach.outreach.OutreachTestSupport;
import io.clubone.outreach.outreach.model.LeadStage;
import io.clubone.outreach.outreach.model.Opportunity;
import io.clubone.outreach.outreach.model.OutreachEvent;
import io.clubone.outreach.outreach.model.OutreachLogEntry;
import io.clubone.outreach.outreach.model.OutreachStep;
import io.clubone.outreach.repo.SafeJdbc;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static io.clubone.outreach.outreach.OutreachTestSupport.NOW;
import static io.clubone.outreach.outreach.OutreachTestSupport.count;
import static io.clubone.outreach.outreach.OutreachTestSupport.lead;
import static org.junit.jupiter.api.Assertions.*;

class OutreachLogRepositoryTest {

	private JdbcTemplate jdbc;
	private OutreachLogRepository repository;
	private Opportunity opportunity;

	@BeforeEach
	void setUp() {
		jdbc = OutreachTestSupport.newDatabase();
		repository = new OutreachLogRepository(new SafeJdbc(jdbc));
		opportunity = new Opportunity(OutreachStep.QUOTE_FOLLOWUP_1, NOW.minus(Duration.ofHours(1)), "tpl",
			lead("L1", LeadStage.QUOTE_SENT, NOW.minus(Duration.ofHours(3))), null, null);
	}

	@Test
	void reserveWritesClaimRow() {
		assertEquals(ReservationResult.RESERVED, repository.tryReserve(opportunity, 1, "run-1", NOW));

		List<OutreachLogEntry> rows = repository.findByDedupKey(opportunity.getDedupKey());
		assertEquals(1, rows.size());
		assertEquals(OutreachEvent.RESERVED, rows.get(0).getEvent());
		assertEquals(1, rows.get(0).getClaimSeq());
		assertEquals("L1", rows.get(0).getLeadId());
		assertEquals(OutreachStep.QUOTE_FOLLOWUP_1, rows.get(0).getStep());
	}

	@Test
	void claimTakenSinceTheLedgerReadConflicts() {
		// another writer reserved and finished the step after this writer read the ledger
		jdbc.update("INSERT INTO crm_outreach_log (id, event, lead_id, dedup_key, claim_seq, created_at) VALUES (?, ?, ?, ?, ?, ?)",
			"other", "crm_outreach_reserved", "L1", opportunity.getDedupKey(), 1, Timestamp.from(NOW));
		repository.append(entry(OutreachEvent.SENT, opportunity.getDedupKey(), NOW));

		assertEquals(ReservationResult.CONFLICT, repository.tryReserve(opportunity, 1, "run-2", NOW));
		assertEquals(1, count(jdbc, "SELECT COUNT(1) FROM crm_outreach_log WHERE dedup_key = ? AND event = 'crm_outreach_reserved'",
			opportunity.getDedupKey()));
	}

	@Test
	void duplicateClaimSequenceIsRejectedByIndex() {
		jdbc.update("INSERT INTO crm_outreach_log (id, event, dedup_key, claim_seq, created_at) VALUES (?, ?, ?, ?, ?)",
			"a", "crm_outreach_reserved", opportunity.getDedupKey(), 1, Timestamp.from(NOW));

		assertThrows(DuplicateKeyException.class, () ->
			jdbc.update("INSERT INTO crm_outreach_log (id, event, dedup_key, claim_seq, created_at) VALUES (?, ?, ?, ?, ?)",
				"b", "crm_outreach_reserved", opportunity.getDedupKey(), 1, Timestamp.from(NOW)));
	}

	@Test
	void retryAfterFailureReservesUnderNextClaimNumber() {
		assertEquals(ReservationResult.RESERVED, repository.tryReserve(opportunity, 1, "run-1", NOW));
		repository.append(entry(OutreachEvent.FAILED, opportunity.getDedupKey(), NOW));

		assertEquals(ReservationResult.RESERVED, repository.tryReserve(opportunity, 2, "run-2", NOW.plus(Duration.ofMinutes(6))));

		assertEquals(2, count(jdbc, "SELECT MAX(claim_seq) FROM crm_outreach_log WHERE dedup_key = ?", opportunity.getDedupKey()));
	}

	@Test
	void missingTableReportsUnavailable() {
		jdbc.execute("DROP TABLE crm_outreach_log");

		assertEquals(ReservationResult.UNAVAILABLE, repository.tryReserve(opportunity, 1, "run-1", NOW));
		assertFalse(repository.append(entry(OutreachEvent.SENT, opportunity.getDedupKey(), NOW)));
		assertTrue(repository.readLedgerEntries(NOW.minus(Duration.ofDays(7)), 10).isEmpty());
	}

	@Test
	void ledgerReadHonoursWindowAndSkipsNonLedgerEvents() {
		repository.append(entry(OutreachEvent.SENT, "k1", NOW.minus(Duration.ofDays(1))));
		repository.append(entry(OutreachEvent.SENT, "k2", NOW.minus(Duration.ofDays(8))));
		repository.append(entry(OutreachEvent.TAGGING_FAILED, "k1", NOW.minus(Duration.ofHours(1))));
		jdbc.update("INSERT INTO crm_outreach_log (id, event, dedup_key, created_at) VALUES (?, ?, ?, ?)",
			"legacy", "crm_outreach_unknown", "k3", Timestamp.from(NOW));

		List<OutreachLogEntry> entries = repository.readLedgerEntries(NOW.minus(Duration.ofDays(7)), 100);

		assertEquals(1, entries.size());
		assertEquals("k1", entries.get(0).getDedupKey());
		assertEquals(OutreachEvent.SENT, entries.get(0).getEvent());
		assertEquals(1, repository.countSince(OutreachEvent.SENT, NOW.minus(Duration.ofDays(2))));
		assertEquals(2, repository.recent(List.of(OutreachEvent.SENT, OutreachEvent.TAGGING_FAILED), 2).size());
	}

	@Test
	void appendStoresStatusAndLevelAndTruncatesMessage() {
		OutreachLogEntry failed = entry(OutreachEvent.FAILED, "k1", NOW);
		failed.setMessage("x".repeat(600));

		assertTrue(repository.append(failed));

		assertEquals(1, count(jdbc, "SELECT COUNT(1) FROM crm_outreach_log WHERE status = 'failed' AND level = 'error'"));
		assertEquals(500, count(jdbc, "SELECT LENGTH(message) FROM crm_outreach_log WHERE dedup_key = 'k1'"));
	}

	private static OutreachLogEntry entry(OutreachEvent event, String key, Instant at) {
		OutreachLogEntry entry = new OutreachLogEntry();
		entry.setEvent(event);
		entry.setLeadId("L1");
		entry.setDedupKey(key);
		entry.setMessage(event.getCode());
		entry.setCreatedAt(at);
		return entry;
	}
}
