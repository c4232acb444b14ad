package io.clubone.outreach.outreach.ledger;

import io.clubone.outreach.outreach.model.OutreachEvent;
import io.clubone.outreach.outreach.model.OutreachLogEntry;
import io.clubone.outreach.outreach.model.StepState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of the trailing-window outreach log, read once at run start.
 *
 * <p>Per dedup key:
 * <ul>
 *   <li>a sent or skipped entry closes the key;</li>
 *   <li>more reservations than failures means an attempt is in flight, which also blocks the key.
 *       Past the grace period such a reservation is orphaned and stays blocked;</li>
 *   <li>reservations all matched by failures re-open the key once the backoff for that attempt has
 *       elapsed, until the attempt budget is spent.</li>
 * </ul>
 *
 * <p>Steps of one drip go out in order: a {@link StepState#BLOCKED} step holds back the steps
 * after it, a {@link StepState#CLEARED} one lets them through.
 */
public final class OutreachLedger {

	private final Map<String, KeyHistory> byKey;
	private final Map<String, Integer> sentByLead;
	private final int maxAttempts;
	private final List<Duration> backoff;
	private final Duration gracePeriod;

	private OutreachLedger(Map<String, KeyHistory> byKey, Map<String, Integer> sentByLead,
			int maxAttempts, List<Duration> backoff, Duration gracePeriod) {
		this.byKey = byKey;
		this.sentByLead = sentByLead;
		this.maxAttempts = maxAttempts;
		this.backoff = backoff;
		this.gracePeriod = gracePeriod;
	}

	public static OutreachLedger of(Collection<OutreachLogEntry> entries, int maxAttempts,
			List<Duration> backoff, Duration gracePeriod) {
		Map<String, KeyHistory> byKey = new HashMap<>();
		Map<String, Integer> sentByLead = new HashMap<>();
		for (OutreachLogEntry entry : entries) {
			OutreachEvent event = entry.getEvent();
			if (event == null || !event.isLedgerEvent()) {
				continue;
			}
			if (event == OutreachEvent.SENT && entry.getLeadId() != null) {
				sentByLead.merge(entry.getLeadId(), 1, Integer::sum);
			}
			if (entry.getDedupKey() == null) {
				continue;
			}
			byKey.computeIfAbsent(entry.getDedupKey(), KeyHistory::new).add(entry);
		}
		return new OutreachLedger(byKey, sentByLead, Math.max(1, maxAttempts),
			backoff == null || backoff.isEmpty() ? List.of(Duration.ZERO) : List.copyOf(backoff),
			gracePeriod != null ? gracePeriod : Duration.ZERO);
	}

	public static OutreachLedger empty() {
		return of(List.of(), 1, List.of(), Duration.ZERO);
	}

	public StepState state(String dedupKey, Instant now) {
		KeyHistory history = byKey.get(dedupKey);
		if (history == null) {
			return StepState.OPEN;
		}
		if (history.closed) {
			return StepState.CLEARED;
		}
		if (history.isInFlight()) {
			return StepState.BLOCKED;
		}
		if (history.failed >= maxAttempts) {
			return StepState.CLEARED;
		}
		if (history.failed == 0) {
			// reservations with matching outcomes only; nothing pending
			return StepState.OPEN;
		}
		Duration wait = backoff.get(Math.min(history.failed, backoff.size()) - 1);
		Instant lastFailure = history.lastFailedAt != null ? history.lastFailedAt : Instant.MIN;
		return now.isBefore(lastFailure.plus(wait)) ? StepState.BLOCKED : StepState.OPEN;
	}

	public boolean isHandled(String dedupKey, Instant now) {
		return state(dedupKey, now) != StepState.OPEN;
	}

	public boolean hasHistory(String dedupKey) {
		return byKey.containsKey(dedupKey);
	}

	public boolean isClosed(String dedupKey) {
		KeyHistory history = byKey.get(dedupKey);
		return history != null && history.closed;
	}

	/**
	 * In flight with a reservation younger than the grace period.
	 */
	public boolean isPending(String dedupKey, Instant now) {
		KeyHistory history = byKey.get(dedupKey);
		return history != null && !history.closed && history.isInFlight()
			&& history.lastReservedAt != null && history.lastReservedAt.plus(gracePeriod).isAfter(now);
	}

	public boolean isOrphaned(String dedupKey, Instant now) {
		KeyHistory history = byKey.get(dedupKey);
		return history != null && !history.closed && history.isInFlight() && !isPending(dedupKey, now);
	}

	/**
	 * Claim number the next reservation of this key must take. Two writers reading the same
	 * log pick the same number and the unique claim index lets only one of them through.
	 */
	public int nextClaim(String dedupKey) {
		KeyHistory history = byKey.get(dedupKey);
		return history != null ? history.reserved + 1 : 1;
	}

	public int sentCount(String leadId) {
		return sentByLead.getOrDefault(leadId, 0);
	}

	public int failedCount(String dedupKey) {
		KeyHistory history = byKey.get(dedupKey);
		return history != null ? history.failed : 0;
	}

	/**
	 * Reservations with no outcome older than the grace period. Never retried automatically.
	 */
	public List<OrphanedReservation> orphanedReservations(Instant now) {
		List<OrphanedReservation> out = new ArrayList<>();
		for (KeyHistory history : byKey.values()) {
			if (history.closed || !history.isInFlight() || history.lastReservedAt == null) {
				continue;
			}
			if (!history.lastReservedAt.plus(gracePeriod).isAfter(now)) {
				out.add(new OrphanedReservation(history.dedupKey, history.leadId, history.lastReservedAt));
			}
		}
		out.sort((a, b) -> a.getReservedAt().compareTo(b.getReservedAt()));
		return out;
	}

	public int size() {
		return byKey.size();
	}

	private static final class KeyHistory {
		private final String dedupKey;
		private String leadId;
		private boolean closed;
		private int reserved;
		private int failed;
		private Instant lastReservedAt;
		private Instant lastFailedAt;

		private KeyHistory(String dedupKey) {
			this.dedupKey = dedupKey;
		}

		private void add(OutreachLogEntry entry) {
			if (leadId == null) {
				leadId = entry.getLeadId();
			}
			Instant at = entry.getCreatedAt();
			switch (entry.getEvent()) {
				case SENT:
				case SKIPPED:
					closed = true;
					break;
				case RESERVED:
					reserved++;
					lastReservedAt = latest(lastReservedAt, at);
					break;
				case FAILED:
					failed++;
					lastFailedAt = latest(lastFailedAt, at);
					break;
				default:
					break;
			}
		}

		private boolean isInFlight() {
			return reserved > failed;
		}

		private static Instant latest(Instant current, Instant candidate) {
			if (candidate == null) {
				return current;
			}
			return current == null || candidate.isAfter(current) ? candidate : current;
		}
	}

	public static final class OrphanedReservation {
		private final String dedupKey;
		private final String leadId;
		private final Instant reservedAt;

		public OrphanedReservation(String dedupKey, String leadId, Instant reservedAt) {
			this.dedupKey = dedupKey;
			this.leadId = leadId;
			this.reservedAt = reservedAt;
		}

		public String getDedupKey() {
			return dedupKey;
		}

		public String getLeadId() {
			return leadId;
		}

		public Instant getReservedAt() {
			return reservedAt;
		}
	}
}
