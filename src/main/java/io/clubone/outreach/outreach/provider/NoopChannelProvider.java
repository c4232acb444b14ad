package io.clubone.outreach.outreach.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class NoopChannelProvider implements ChannelProvider {

	private static final Logger log = LoggerFactory.getLogger(NoopChannelProvider.class);

	@Override
	public ChannelResult send(String to, String templateId, Map<String, String> variables) {
		log.debug("NOOP channel send: to={} template={} variables={}", to, templateId, variables.keySet());
		return ChannelResult.ok(200);
	}
}
