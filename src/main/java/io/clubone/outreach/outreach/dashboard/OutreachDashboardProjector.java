package io.clubone.outreach.outreach.dashboard;

import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.RunMode;
import io.clubone.outreach.outreach.crm.CrmSnapshot;
import io.clubone.outreach.outreach.crm.CrmSnapshotLoader;
import io.clubone.outreach.outreach.exception.DataStoreUnavailableException;
import io.clubone.outreach.outreach.failure.AutomationFailureRecorder;
import io.clubone.outreach.outreach.ledger.OutreachLedgerReader;
import io.clubone.outreach.outreach.ledger.OutreachRunContext;
import io.clubone.outreach.outreach.ledger.ThrottlePolicy;
import io.clubone.outreach.outreach.ledger.OutreachLogRepository;
import io.clubone.outreach.outreach.model.Opportunity;
import io.clubone.outreach.outreach.model.OutreachDashboard;
import io.clubone.outreach.outreach.model.OutreachEvent;
import io.clubone.outreach.outreach.model.UpcomingOutreach;
import io.clubone.outreach.outreach.rules.OpportunityGenerator;
import io.clubone.outreach.outreach.rules.OpportunitySelector;
import io.clubone.outreach.repo.SafeJdbc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static io.clubone.outreach.outreach.model.Opportunity.failureEventPattern;

/**
 * Read-only snapshot for the admin outreach page. Performs no writes.
 */
@Component
public class OutreachDashboardProjector {

	private static final Logger log = LoggerFactory.getLogger(OutreachDashboardProjector.class);

	static final List<OutreachEvent> RECENT_EVENTS = List.of(
		OutreachEvent.SENT, OutreachEvent.SKIPPED, OutreachEvent.FAILED, OutreachEvent.TAGGING_FAILED);

	private final SafeJdbc db;
	private final CrmSnapshotLoader snapshotLoader;
	private final OpportunityGenerator generator;
	private final OpportunitySelector selector;
	private final OutreachLedgerReader ledgerReader;
	private final ThrottlePolicy throttle;
	private final OutreachLogRepository logRepository;
	private final AutomationFailureRecorder failureRecorder;
	private final OutreachProperties props;
	private final Clock clock;

	public OutreachDashboardProjector(SafeJdbc db, CrmSnapshotLoader snapshotLoader, OpportunityGenerator generator,
			OpportunitySelector selector, OutreachLedgerReader ledgerReader, ThrottlePolicy throttle,
			OutreachLogRepository logRepository, AutomationFailureRecorder failureRecorder,
			OutreachProperties props, Clock clock) {
		this.db = db;
		this.snapshotLoader = snapshotLoader;
		this.generator = generator;
		this.selector = selector;
		this.ledgerReader = ledgerReader;
		this.throttle = throttle;
		this.logRepository = logRepository;
		this.failureRecorder = failureRecorder;
		this.props = props;
		this.clock = clock;
	}

	public OutreachDashboard project() {
		try {
			db.probe();
		} catch (DataStoreUnavailableException e) {
			log.warn("Outreach dashboard empty, data store unavailable: error={}", e.getMessage());
			return OutreachDashboard.empty();
		}

		Instant now = Instant.now(clock);
		CrmSnapshot snapshot = snapshotLoader.load(now);
		OutreachRunContext context = new OutreachRunContext(null, RunMode.MOCK, now, ledgerReader.read(now));
		List<Opportunity> eligible = selector.firstEligiblePerType(
			generator.generate(snapshot.getLeads(), snapshot.getBookings(), snapshot.getPayments()),
			context::state);
		List<Opportunity> upcoming = selector.upcoming(eligible, now).stream()
			.filter(o -> throttle.evaluate(o, context) == ThrottlePolicy.Verdict.ALLOW)
			.collect(Collectors.toList());

		OutreachDashboard dashboard = new OutreachDashboard();
		dashboard.setUpcoming(upcoming.stream()
			.limit(props.getUpcomingLimit())
			.map(UpcomingOutreach::from)
			.collect(Collectors.toList()));
		dashboard.setRecent(logRepository.recent(RECENT_EVENTS, props.getRecentLimit()));
		dashboard.setFailures(failureRecorder.openFailures(failureEventPattern(), props.getFailureLimit()));

		OutreachDashboard.Summary summary = dashboard.getSummary();
		summary.setScheduled(upcoming.size());
		summary.setSentLast24h(logRepository.countSince(OutreachEvent.SENT, now.minus(props.getRecentActivityWindow())));
		summary.setFailuresOpen(failureRecorder.openCount(failureEventPattern()));
		return dashboard;
	}
}
