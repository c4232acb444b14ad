package io.clubone.outreach.outreach.model;

import io.clubone.outreach.outreach.RunMode;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
public class OutreachRunSummary {
	private boolean ok;
	private String runId;
	private RunMode mode;
	private int processed;
	private int sent;
	private int skipped;
	private int failed;
	private Instant runAt;
	private String reason;
	private List<String> planned = new ArrayList<>();   // MOCK runs only

	public static OutreachRunSummary notOk(RunMode mode, Instant runAt, String reason) {
		OutreachRunSummary summary = new OutreachRunSummary();
		summary.setOk(false);
		summary.setMode(mode);
		summary.setRunAt(runAt);
		summary.setReason(reason);
		return summary;
	}
}
