package io.clubone.outreach.outreach.ledger;

import io.clubone.outreach.outreach.model.Opportunity;
import io.clubone.outreach.outreach.model.OutreachEvent;
import io.clubone.outreach.outreach.model.OutreachLogEntry;
import io.clubone.outreach.outreach.model.OutreachStep;
import io.clubone.outreach.outreach.model.OutreachType;
import io.clubone.outreach.repo.SafeJdbc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only access to crm_outreach_log. Rows are never updated or deleted.
 */
@Repository
public class OutreachLogRepository {

	private static final Logger log = LoggerFactory.getLogger(OutreachLogRepository.class);

	private static final String COLUMNS =
		"id, event, lead_id, dedup_key, outreach_type, step, claim_seq, message, meta, created_at";

	private static final RowMapper<OutreachLogEntry> ENTRY_MAPPER = (rs, rowNum) -> {
		OutreachEvent event = OutreachEvent.fromCode(rs.getString("event"));
		if (event == null) {
			return null;
		}
		OutreachLogEntry entry = new OutreachLogEntry();
		entry.setId(rs.getString("id"));
		entry.setEvent(event);
		entry.setLeadId(rs.getString("lead_id"));
		entry.setDedupKey(rs.getString("dedup_key"));
		entry.setType(OutreachType.fromCode(rs.getString("outreach_type")));
		entry.setStep(OutreachStep.fromCode(rs.getString("step")));
		int claimSeq = rs.getInt("claim_seq");
		entry.setClaimSeq(rs.wasNull() ? null : claimSeq);
		entry.setMessage(rs.getString("message"));
		entry.setMeta(rs.getString("meta"));
		entry.setCreatedAt(SafeJdbc.instant(rs.getTimestamp("created_at")));
		return entry;
	};

	private final SafeJdbc db;

	public OutreachLogRepository(SafeJdbc db) {
		this.db = db;
	}

	/**
	 * Ledger events (reserved, sent, skipped, failed) created at or after {@code since}, newest first.
	 */
	public List<OutreachLogEntry> readLedgerEntries(Instant since, int limit) {
		List<OutreachEvent> ledgerEvents = new ArrayList<>();
		for (OutreachEvent event : OutreachEvent.values()) {
			if (event.isLedgerEvent()) {
				ledgerEvents.add(event);
			}
		}
		List<Object> args = codes(ledgerEvents);
		args.add(SafeJdbc.timestamp(since));
		args.add(limit);
		return db.selectMany("crm_outreach_log",
			"SELECT " + COLUMNS + " FROM crm_outreach_log WHERE event IN (" + placeholders(ledgerEvents.size()) + ") " +
			"AND created_at >= ? ORDER BY created_at DESC LIMIT ?",
			ENTRY_MAPPER, args.toArray());
	}

	/**
	 * Claims an attempt of an opportunity under {@code claimSeq}, the number derived from the log
	 * the caller decided on. The unique (dedup_key, claim_seq) index turns the insert into a
	 * check-and-set: when anyone reserved the key since that read, the number is taken and this
	 * call reports {@link ReservationResult#CONFLICT}.
	 */
	public ReservationResult tryReserve(Opportunity opportunity, int claimSeq, String runId, Instant now) {
		try {
			db.jdbc().update(
				"INSERT INTO crm_outreach_log (id, event, status, level, lead_id, dedup_key, outreach_type, step, " +
				"claim_seq, message, meta, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
				UUID.randomUUID().toString(),
				OutreachEvent.RESERVED.getCode(),
				OutreachEvent.RESERVED.getStatus(),
				OutreachEvent.RESERVED.getLevel(),
				opportunity.getLead().getId(),
				opportunity.getDedupKey(),
				opportunity.getType().getCode(),
				opportunity.getStep().getCode(),
				claimSeq,
				"Reserved " + opportunity.getStep().getCode(),
				runId != null ? "{\"runId\":\"" + runId + "\"}" : null,
				SafeJdbc.timestamp(now));
			return ReservationResult.RESERVED;
		} catch (DuplicateKeyException e) {
			log.info("Reservation lost to a concurrent writer: dedupKey={} claimSeq={}", opportunity.getDedupKey(), claimSeq);
			return ReservationResult.CONFLICT;
		} catch (DataAccessException e) {
			log.warn("Reservation not written, step will not be dispatched: dedupKey={} error={}",
				opportunity.getDedupKey(), e.getMessage());
			return ReservationResult.UNAVAILABLE;
		}
	}

	/**
	 * @return false when the row could not be written
	 */
	public boolean append(OutreachLogEntry entry) {
		OutreachEvent event = entry.getEvent();
		String id = entry.getId() != null ? entry.getId() : UUID.randomUUID().toString();
		return db.insert("crm_outreach_log",
			"INSERT INTO crm_outreach_log (id, event, status, level, lead_id, dedup_key, outreach_type, step, " +
			"message, meta, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
			id,
			event.getCode(),
			event.getStatus(),
			event.getLevel(),
			entry.getLeadId(),
			entry.getDedupKey(),
			entry.getType() != null ? entry.getType().getCode() : null,
			entry.getStep() != null ? entry.getStep().getCode() : null,
			truncate(entry.getMessage(), 500),
			entry.getMeta(),
			SafeJdbc.timestamp(entry.getCreatedAt()));
	}

	public List<OutreachLogEntry> recent(Collection<OutreachEvent> events, int limit) {
		if (events.isEmpty()) {
			return List.of();
		}
		List<Object> args = codes(events);
		args.add(limit);
		return db.selectMany("crm_outreach_log",
			"SELECT " + COLUMNS + " FROM crm_outreach_log WHERE event IN (" + placeholders(events.size()) + ") " +
			"ORDER BY created_at DESC LIMIT ?",
			ENTRY_MAPPER, args.toArray());
	}

	public int countSince(OutreachEvent event, Instant since) {
		List<Integer> rows = db.selectMany("crm_outreach_log",
			"SELECT COUNT(1) FROM crm_outreach_log WHERE event = ? AND created_at >= ?",
			(rs, rowNum) -> rs.getInt(1),
			event.getCode(), SafeJdbc.timestamp(since));
		return rows.isEmpty() ? 0 : rows.get(0);
	}

	public List<OutreachLogEntry> findByDedupKey(String dedupKey) {
		return db.selectMany("crm_outreach_log",
			"SELECT " + COLUMNS + " FROM crm_outreach_log WHERE dedup_key = ? ORDER BY created_at ASC",
			ENTRY_MAPPER, dedupKey);
	}

	private static List<Object> codes(Collection<OutreachEvent> events) {
		return events.stream().map(OutreachEvent::getCode).collect(Collectors.toCollection(ArrayList::new));
	}

	private static String placeholders(int n) {
		return String.join(", ", Collections.nCopies(n, "?"));
	}

	static String truncate(String value, int max) {
		if (value == null || value.length() <= max) {
			return value;
		}
		return value.substring(0, max);
	}
}
