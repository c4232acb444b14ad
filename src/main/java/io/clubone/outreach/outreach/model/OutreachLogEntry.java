package io.clubone.outreach.outreach.model;

import lombok.Data;

import java.time.Instant;

@Data
public class OutreachLogEntry {
	private String id;
	private OutreachEvent event;
	private String leadId;
	private String dedupKey;
	private OutreachType type;
	private OutreachStep step;
	private Integer claimSeq;       // only set on reserved entries
	private String message;
	private String meta;            // JSON
	private Instant createdAt;

	public String getStatus() {
		return event != null ? event.getStatus() : null;
	}
}
