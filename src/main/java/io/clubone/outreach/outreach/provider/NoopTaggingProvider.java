package io.clubone.outreach.outreach.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class NoopTaggingProvider implements TaggingProvider {

	private static final Logger log = LoggerFactory.getLogger(NoopTaggingProvider.class);

	@Override
	public TaggingResult upsertContact(String email, String phone, String name, List<String> tags) {
		log.debug("NOOP tagging: email={} tags={}", email, tags);
		return TaggingResult.skipped("noop");
	}
}
