package io.clubone.outreach.outreach.ledger;

import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.model.Opportunity;
import org.springframework.stereotype.Component;

/**
 * Last gate before a reservation: contact preference, 7-day send cap, dedup.
 */
@Component
public class ThrottlePolicy {

	public enum Verdict {
		ALLOW,
		DO_NOT_CONTACT,
		THROTTLED,
		DEDUPED
	}

	private final OutreachProperties props;

	public ThrottlePolicy(OutreachProperties props) {
		this.props = props;
	}

	public Verdict evaluate(Opportunity opportunity, OutreachRunContext context) {
		if (opportunity.getLead().isDoNotContact()) {
			return Verdict.DO_NOT_CONTACT;
		}
		if (isOverCap(opportunity, context)) {
			return Verdict.THROTTLED;
		}
		if (context.isHandled(opportunity)) {
			return Verdict.DEDUPED;
		}
		return Verdict.ALLOW;
	}

	public boolean isOverCap(Opportunity opportunity, OutreachRunContext context) {
		return context.sentCount(opportunity.getLead().getId()) >= props.getMaxMessagesPerLead();
	}
}
