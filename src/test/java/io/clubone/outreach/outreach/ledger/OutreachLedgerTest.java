package io.clubone.outreach.outreach.ledger;

import io.clubone.outreach.outreach.model.OutreachEvent;
import io.clubone.outreach.outreach.model.OutreachLogEntry;
import io.clubone.outreach.outreach.model.StepState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static io.clubone.outreach.outreach.OutreachTestSupport.NOW;
import static org.junit.jupiter.api.Assertions.*;

class OutreachLedgerTest {

	private static final String KEY = "crm_outreach:quote_followup:L1:quote_followup_1";
	private static final List<Duration> BACKOFF =
		List.of(Duration.ofMinutes(5), Duration.ofMinutes(15), Duration.ofMinutes(45));
	private static final Duration GRACE = Duration.ofMinutes(30);

	@Test
	void unknownKeyIsOpen() {
		OutreachLedger ledger = ledger();

		assertFalse(ledger.isHandled(KEY, NOW));
		assertEquals(0, ledger.sentCount("L1"));
	}

	@Test
	void sentOrSkippedClosesKey() {
		OutreachLedger sent = ledger(
			entry(OutreachEvent.RESERVED, NOW.minus(Duration.ofHours(1))),
			entry(OutreachEvent.SENT, NOW.minus(Duration.ofHours(1))));
		OutreachLedger skipped = ledger(entry(OutreachEvent.SKIPPED, NOW.minus(Duration.ofDays(2))));

		assertEquals(StepState.CLEARED, sent.state(KEY, NOW));
		assertTrue(sent.isClosed(KEY));
		assertEquals(1, sent.sentCount("L1"));
		assertTrue(skipped.isHandled(KEY, NOW));
		assertEquals(0, skipped.sentCount("L1"));
	}

	@Test
	void reservationWithoutOutcomeBlocksKey() {
		OutreachLedger ledger = ledger(entry(OutreachEvent.RESERVED, NOW.minus(Duration.ofMinutes(2))));

		assertEquals(StepState.BLOCKED, ledger.state(KEY, NOW));
		assertTrue(ledger.isPending(KEY, NOW));
		assertFalse(ledger.isOrphaned(KEY, NOW));
		assertTrue(ledger.orphanedReservations(NOW).isEmpty());
	}

	@Test
	void reservationPastGracePeriodIsOrphanedAndStaysBlocked() {
		Instant reservedAt = NOW.minus(Duration.ofMinutes(31));
		OutreachLedger ledger = ledger(entry(OutreachEvent.RESERVED, reservedAt));

		List<OutreachLedger.OrphanedReservation> orphans = ledger.orphanedReservations(NOW);

		assertEquals(1, orphans.size());
		assertEquals(KEY, orphans.get(0).getDedupKey());
		assertEquals("L1", orphans.get(0).getLeadId());
		assertEquals(reservedAt, orphans.get(0).getReservedAt());
		assertEquals(StepState.BLOCKED, ledger.state(KEY, NOW));
		assertTrue(ledger.isOrphaned(KEY, NOW));
	}

	@Test
	void failedAttemptReopensAfterBackoff() {
		Instant failedAt = NOW.minus(Duration.ofMinutes(3));
		OutreachLedger ledger = ledger(
			entry(OutreachEvent.RESERVED, failedAt),
			entry(OutreachEvent.FAILED, failedAt));

		assertEquals(StepState.BLOCKED, ledger.state(KEY, NOW));
		assertEquals(StepState.OPEN, ledger.state(KEY, failedAt.plus(Duration.ofMinutes(5))));
		assertEquals(1, ledger.failedCount(KEY));
		assertTrue(ledger.orphanedReservations(NOW.plus(Duration.ofHours(1))).isEmpty());
	}

	@Test
	void secondFailureUsesLongerBackoff() {
		Instant lastFailure = NOW.minus(Duration.ofMinutes(10));
		OutreachLedger ledger = ledger(
			entry(OutreachEvent.RESERVED, NOW.minus(Duration.ofMinutes(40))),
			entry(OutreachEvent.FAILED, NOW.minus(Duration.ofMinutes(40))),
			entry(OutreachEvent.RESERVED, lastFailure),
			entry(OutreachEvent.FAILED, lastFailure));

		assertTrue(ledger.isHandled(KEY, NOW));
		assertFalse(ledger.isHandled(KEY, lastFailure.plus(Duration.ofMinutes(15))));
	}

	@Test
	void exhaustedAttemptsClearTheStep() {
		Instant t = NOW.minus(Duration.ofHours(5));
		OutreachLedger ledger = ledger(
			entry(OutreachEvent.RESERVED, t), entry(OutreachEvent.FAILED, t),
			entry(OutreachEvent.RESERVED, t), entry(OutreachEvent.FAILED, t),
			entry(OutreachEvent.RESERVED, t), entry(OutreachEvent.FAILED, t));

		assertEquals(3, ledger.failedCount(KEY));
		assertEquals(StepState.CLEARED, ledger.state(KEY, NOW));
	}

	@Test
	void nextClaimFollowsReservationsInTheRead() {
		Instant t = NOW.minus(Duration.ofHours(1));

		assertEquals(1, ledger().nextClaim(KEY));
		assertEquals(2, ledger(entry(OutreachEvent.RESERVED, t), entry(OutreachEvent.FAILED, t)).nextClaim(KEY));
		assertEquals(3, ledger(
			entry(OutreachEvent.RESERVED, t), entry(OutreachEvent.FAILED, t),
			entry(OutreachEvent.RESERVED, t), entry(OutreachEvent.FAILED, t)).nextClaim(KEY));
	}

	@Test
	void nonLedgerEventsAreIgnored() {
		OutreachLogEntry tagging = entry(OutreachEvent.TAGGING_FAILED, NOW);
		OutreachLogEntry bookkeeping = entry(OutreachEvent.BOOKKEEPING_SKIPPED, NOW);
		bookkeeping.setDedupKey(null);

		OutreachLedger ledger = ledger(tagging, bookkeeping);

		assertFalse(ledger.isHandled(KEY, NOW));
		assertEquals(0, ledger.size());
	}

	@Test
	void sentCountSpansAllKeysOfALead() {
		OutreachLogEntry other = entry(OutreachEvent.SENT, NOW.minus(Duration.ofDays(1)));
		other.setDedupKey("crm_outreach:reengagement:L1:reengage_1");

		OutreachLedger ledger = ledger(entry(OutreachEvent.SENT, NOW.minus(Duration.ofDays(2))), other);

		assertEquals(2, ledger.sentCount("L1"));
		assertEquals(0, ledger.sentCount("L2"));
	}

	private static OutreachLedger ledger(OutreachLogEntry... entries) {
		return OutreachLedger.of(List.of(entries), 3, BACKOFF, GRACE);
	}

	private static OutreachLogEntry entry(OutreachEvent event, Instant at) {
		OutreachLogEntry entry = new OutreachLogEntry();
		entry.setEvent(event);
		entry.setLeadId("L1");
		entry.setDedupKey(KEY);
		entry.setCreatedAt(at);
		return entry;
	}
}
