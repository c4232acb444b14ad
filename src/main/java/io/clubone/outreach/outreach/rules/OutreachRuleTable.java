package io.clubone.outreach.outreach.rules;

import io.clubone.outreach.outreach.model.LeadStage;
import io.clubone.outreach.outreach.model.OutreachStep;
import io.clubone.outreach.outreach.model.OutreachType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stage to candidate steps. Stateless.
 */
@Component
public class OutreachRuleTable {

	/**
	 * Lead-driven steps for a stage, in drip order. Closed or unknown stages get none.
	 */
	public List<OutreachStep> leadSteps(LeadStage stage) {
		if (stage == null || stage.isClosed()) {
			return List.of();
		}
		switch (stage) {
			case QUOTE_SENT:
				return stepsOf(OutreachType.QUOTE_FOLLOWUP);
			case QUALIFIED:
				return stepsOf(OutreachType.REENGAGEMENT);
			default:
				return List.of();
		}
	}

	/**
	 * Steps driven by a pending payment, measured from the payment's creation.
	 */
	public List<OutreachStep> paymentSteps() {
		return stepsOf(OutreachType.PAYMENT_REMINDER);
	}

	public Instant dueAt(OutreachStep step, Instant base) {
		return base.plus(step.getDelay());
	}

	public List<OutreachStep> stepsOf(OutreachType type) {
		return Arrays.stream(OutreachStep.values())
			.filter(step -> step.getType() == type)
			.collect(Collectors.toList());
	}
}
