package io.clubone.outreach.outreach.provider;

import io.clubone.outreach.outreach.OutreachProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Audience member upsert followed by a tag POST. Members are addressed by the md5 of the lowercased email.
 */
@Service
public class HttpTaggingProvider implements TaggingProvider {

	private static final Logger log = LoggerFactory.getLogger(HttpTaggingProvider.class);

	private final OutreachProperties props;
	private final RetryTemplate retryTemplate;
	private final RestTemplate rt;

	@Autowired
	public HttpTaggingProvider(OutreachProperties props, RetryTemplate taggingRetryTemplate) {
		this(props, taggingRetryTemplate, createRestTemplate(props.getTagging().getHttp().getTimeoutMs()));
	}

	HttpTaggingProvider(OutreachProperties props, RetryTemplate retryTemplate, RestTemplate rt) {
		this.props = props;
		this.retryTemplate = retryTemplate;
		this.rt = rt;
	}

	private static RestTemplate createRestTemplate(int timeoutMs) {
		SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
		factory.setConnectTimeout(timeoutMs);
		factory.setReadTimeout(timeoutMs);
		return new RestTemplate(factory);
	}

	@Override
	public TaggingResult upsertContact(String email, String phone, String name, List<String> tags) {
		OutreachProperties.Tagging.Http http = props.getTagging().getHttp();
		String apiKey = trim(http.getApiKey());
		String baseUrl = trim(http.getBaseUrl());
		String audienceId = trim(http.getAudienceId());
		if (apiKey.isEmpty() || baseUrl.isEmpty() || audienceId.isEmpty()) {
			return TaggingResult.skipped("missing_config");
		}
		String address = trim(email).toLowerCase();
		if (address.isEmpty()) {
			return TaggingResult.skipped("missing_email");
		}

		String memberUrl = stripTrailingSlash(baseUrl) + "/lists/" + audienceId + "/members/" + memberHash(address);
		HttpHeaders headers = new HttpHeaders();
		headers.setContentType(MediaType.APPLICATION_JSON);
		headers.set(HttpHeaders.AUTHORIZATION, "Basic " + Base64.getEncoder()
				.encodeToString(("anystring:" + apiKey).getBytes(StandardCharsets.UTF_8)));

		String[] names = splitName(name);
		Map<String, Object> mergeFields = new LinkedHashMap<>();
		putIfPresent(mergeFields, "FNAME", names[0]);
		putIfPresent(mergeFields, "LNAME", names[1]);
		putIfPresent(mergeFields, "PHONE", trim(phone));
		Map<String, Object> member = new LinkedHashMap<>();
		member.put("email_address", address);
		member.put("status_if_new", "subscribed");
		member.put("merge_fields", mergeFields);

		try {
			retryTemplate.execute(ctx -> exchange(HttpMethod.PUT, memberUrl, member, headers));
		} catch (HttpClientErrorException e) {
			log.warn("Tagging member upsert rejected: statusCode={}", e.getStatusCode().value());
			return TaggingResult.fail("upsert_failed");
		} catch (RestClientException e) {
			log.warn("Tagging member upsert failed after retries: error={}", e.getMessage());
			return TaggingResult.fail(e.getMessage() != null ? e.getMessage() : "upsert_failed");
		}

		List<String> normalizedTags = normalizeTags(tags);
		if (normalizedTags.isEmpty()) {
			return TaggingResult.ok();
		}
		List<Map<String, String>> tagBody = new ArrayList<>();
		for (String tag : normalizedTags) {
			tagBody.add(Map.of("name", tag, "status", "active"));
		}
		try {
			retryTemplate.execute(ctx -> exchange(HttpMethod.POST, memberUrl + "/tags", Map.of("tags", tagBody), headers));
		} catch (HttpClientErrorException e) {
			log.warn("Tagging rejected: statusCode={} tags={}", e.getStatusCode().value(), normalizedTags);
			return TaggingResult.fail("tagging_failed");
		} catch (RestClientException e) {
			log.warn("Tagging failed after retries: tags={} error={}", normalizedTags, e.getMessage());
			return TaggingResult.fail(e.getMessage() != null ? e.getMessage() : "tagging_failed");
		}
		log.debug("Tagging contact updated: tags={}", normalizedTags);
		return TaggingResult.ok();
	}

	private Integer exchange(HttpMethod method, String url, Object body, HttpHeaders headers) {
		return rt.exchange(url, method, new HttpEntity<>(body, headers), String.class).getStatusCode().value();
	}

	static String memberHash(String email) {
		return DigestUtils.md5DigestAsHex(email.getBytes(StandardCharsets.UTF_8));
	}

	static String[] splitName(String name) {
		String cleaned = trim(name);
		if (cleaned.isEmpty()) {
			return new String[] {"", ""};
		}
		String[] parts = cleaned.split("\\s+", 2);
		return new String[] {parts[0], parts.length > 1 ? parts[1] : ""};
	}

	private static List<String> normalizeTags(List<String> tags) {
		Set<String> out = new LinkedHashSet<>();
		if (tags != null) {
			for (String tag : tags) {
				String t = trim(tag);
				if (!t.isEmpty()) {
					out.add(t);
				}
			}
		}
		return new ArrayList<>(out);
	}

	private static void putIfPresent(Map<String, Object> map, String key, String value) {
		if (value != null && !value.isEmpty()) {
			map.put(key, value);
		}
	}

	private static String trim(String value) {
		return value == null ? "" : value.trim();
	}

	private static String stripTrailingSlash(String url) {
		String value = url;
		while (value.endsWith("/")) {
			value = value.substring(0, value.length() - 1);
		}
		return value;
	}
}
