package io.clubone.outreach.outreach.rules;

import io.clubone.outreach.outreach.model.Opportunity;
import io.clubone.outreach.outreach.model.StepState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Linear drip selection: per (lead, type) only the earliest open step is eligible, and only
 * once every step before it is cleared.
 */
@Component
public class OpportunitySelector {

	static final Comparator<Opportunity> DUE_ORDER = Comparator
		.comparing(Opportunity::getDueAt)
		.thenComparing(o -> o.getStep().ordinal())
		.thenComparing(Opportunity::getDedupKey);

	private static final Comparator<Opportunity> STEP_ORDER = Comparator
		.comparing((Opportunity o) -> o.getStep().ordinal())
		.thenComparing(Opportunity::getDueAt);

	/**
	 * Walks each (lead, type) drip in step order: cleared steps are passed over, the first open
	 * step is selected, and a blocked step stops the walk so nothing after it goes out early.
	 */
	public List<Opportunity> firstEligiblePerType(List<Opportunity> candidates, Function<Opportunity, StepState> state) {
		Map<String, List<Opportunity>> byLeadAndType = new LinkedHashMap<>();
		for (Opportunity o : candidates) {
			byLeadAndType.computeIfAbsent(o.getLead().getId() + "|" + o.getType().getCode(), k -> new ArrayList<>()).add(o);
		}
		List<Opportunity> eligible = new ArrayList<>();
		for (List<Opportunity> group : byLeadAndType.values()) {
			group.sort(STEP_ORDER);
			for (Opportunity o : group) {
				StepState current = state.apply(o);
				if (current == StepState.CLEARED) {
					continue;
				}
				if (current == StepState.OPEN) {
					eligible.add(o);
				}
				break;
			}
		}
		return eligible;
	}

	/**
	 * Opportunities with due time at or before {@code now}, earliest first.
	 */
	public List<Opportunity> due(List<Opportunity> eligible, Instant now) {
		return eligible.stream()
			.filter(o -> o.isDue(now))
			.sorted(DUE_ORDER)
			.collect(Collectors.toList());
	}

	/**
	 * Earliest eligible step regardless of due time, used by the single-lead trigger.
	 */
	public Optional<Opportunity> earliest(List<Opportunity> eligible) {
		return eligible.stream().min(DUE_ORDER);
	}

	public List<Opportunity> upcoming(List<Opportunity> eligible, Instant now) {
		return eligible.stream()
			.filter(o -> !o.isDue(now))
			.sorted(DUE_ORDER)
			.collect(Collectors.toList());
	}
}
