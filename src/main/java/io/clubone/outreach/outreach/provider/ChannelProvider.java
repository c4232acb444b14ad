package io.clubone.outreach.outreach.provider;

import java.util.Map;

/**
 * Delivers a templated message to a contact address.
 */
public interface ChannelProvider {

	ChannelResult send(String to, String templateId, Map<String, String> variables);
}
