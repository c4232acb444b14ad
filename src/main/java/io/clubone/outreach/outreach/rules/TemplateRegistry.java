package io.clubone.outreach.outreach.rules;

import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.exception.OutreachConfigurationException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import io.clubone.outreach.outreach.model.OutreachStep;

/**
 * Explicit step to channel template map, validated once at startup.
 */
@Component
public class TemplateRegistry {

	private static final Logger log = LoggerFactory.getLogger(TemplateRegistry.class);

	private final OutreachProperties props;
	private final Map<OutreachStep, String> templates = new EnumMap<>(OutreachStep.class);

	public TemplateRegistry(OutreachProperties props) {
		this.props = props;
	}

	@PostConstruct
	public void validate() {
		templates.clear();
		List<String> missing = new ArrayList<>();
		for (OutreachStep step : OutreachStep.values()) {
			String template = props.getTemplates().get(step.getCode());
			if (template == null || template.isBlank()) {
				missing.add(step.getCode());
			} else {
				templates.put(step, template.trim());
			}
		}
		if (missing.isEmpty()) {
			log.info("Outreach templates configured for all {} steps", templates.size());
			return;
		}
		if (props.isStrictTemplates()) {
			throw new OutreachConfigurationException("Missing channel template for outreach steps", missing);
		}
		log.warn("Outreach steps without a channel template will be skipped: steps={}", missing);
	}

	/**
	 * @return template id, or null when the step has none
	 */
	public String resolve(OutreachStep step) {
		return templates.get(step);
	}
}
