package io.clubone.outreach.outreach.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only snapshot for the admin outreach page.
 */
@Data
public class OutreachDashboard {
	private List<UpcomingOutreach> upcoming = new ArrayList<>();
	private List<OutreachLogEntry> recent = new ArrayList<>();
	private List<AutomationFailure> failures = new ArrayList<>();
	private Summary summary = new Summary();

	@Data
	public static class Summary {
		private int scheduled;
		private int sentLast24h;
		private int failuresOpen;
	}

	public static OutreachDashboard empty() {
		return new OutreachDashboard();
	}
}
