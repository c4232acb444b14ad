package io.clubone.outreach.outreach.ledger;

import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.model.OutreachLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Reads the throttle window of the outreach log into an {@link OutreachLedger}.
 */
@Component
public class OutreachLedgerReader {

	private static final Logger log = LoggerFactory.getLogger(OutreachLedgerReader.class);

	private final OutreachLogRepository logRepository;
	private final OutreachProperties props;

	public OutreachLedgerReader(OutreachLogRepository logRepository, OutreachProperties props) {
		this.logRepository = logRepository;
		this.props = props;
	}

	public OutreachLedger read(Instant now) {
		Instant since = now.minus(props.getThrottleWindow());
		List<OutreachLogEntry> entries = logRepository.readLedgerEntries(since, props.getLogReadLimit());
		if (entries.size() >= props.getLogReadLimit()) {
			log.warn("Outreach log read hit its limit, older entries in the window are ignored: limit={} since={}",
				props.getLogReadLimit(), since);
		}
		OutreachLedger ledger = OutreachLedger.of(entries,
			props.getRetry().getMaxAttempts(),
			props.getRetry().getBackoff(),
			props.getReservation().getGracePeriod());
		log.debug("Outreach ledger loaded: entries={} keys={} since={}", entries.size(), ledger.size(), since);
		return ledger;
	}
}
