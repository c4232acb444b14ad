package io.clubone.outreach.outreach.provider;

import java.util.List;

/**
 * Maintains contact segmentation tags. Called best-effort after a send.
 */
public interface TaggingProvider {

	TaggingResult upsertContact(String email, String phone, String name, List<String> tags);
}
