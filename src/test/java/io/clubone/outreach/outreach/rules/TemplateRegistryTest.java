package io.clubone.outreach.outreach.rules;

import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.OutreachTestSupport;
import io.clubone.outreach.outreach.exception.OutreachConfigurationException;
import io.clubone.outreach.outreach.model.OutreachStep;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TemplateRegistryTest {

	@Test
	void resolvesEveryConfiguredStep() {
		TemplateRegistry registry = new TemplateRegistry(OutreachTestSupport.properties());
		registry.validate();

		for (OutreachStep step : OutreachStep.values()) {
			assertEquals("tpl_" + step.getCode(), registry.resolve(step));
		}
	}

	@Test
	void strictModeFailsStartupOnMissingTemplate() {
		OutreachProperties props = OutreachTestSupport.properties();
		props.getTemplates().remove("reengage_1");
		props.getTemplates().put("payment_reminder_3", "  ");

		OutreachConfigurationException e = assertThrows(OutreachConfigurationException.class,
			() -> new TemplateRegistry(props).validate());

		assertTrue(e.getMissingKeys().contains("reengage_1"));
		assertTrue(e.getMissingKeys().contains("payment_reminder_3"));
		assertEquals(2, e.getMissingKeys().size());
	}

	@Test
	void lenientModeLeavesMissingStepsUnresolved() {
		OutreachProperties props = OutreachTestSupport.properties();
		props.setStrictTemplates(false);
		props.getTemplates().remove("quote_followup_2");
		TemplateRegistry registry = new TemplateRegistry(props);

		registry.validate();

		assertNull(registry.resolve(OutreachStep.QUOTE_FOLLOWUP_2));
		assertEquals("tpl_quote_followup_1", registry.resolve(OutreachStep.QUOTE_FOLLOWUP_1));
	}
}
