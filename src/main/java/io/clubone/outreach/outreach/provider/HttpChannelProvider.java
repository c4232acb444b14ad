package io.clubone.outreach.outreach.provider;

import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.metrics.OutreachMetrics;
import io.clubone.outreach.outreach.ratelimit.OutreachRateLimiter;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WhatsApp template sends through the campaign API.
 * 4xx answers are final and come back as a failed result. 5xx answers and connections that never
 * got established propagate so Resilience4j can retry them, and the circuit breaker fallback turns
 * exhaustion into a failed result. A request that went out without an answer, such as a read
 * timeout, may have been delivered: it is reported failed once and left to the ledger backoff.
 */
@Service
public class HttpChannelProvider implements ChannelProvider {

	private static final Logger log = LoggerFactory.getLogger(HttpChannelProvider.class);

	private final OutreachProperties props;
	private final RestTemplate rt;
	private final OutreachRateLimiter rateLimiter;
	private final OutreachMetrics metrics;

	@Autowired
	public HttpChannelProvider(OutreachProperties props, OutreachRateLimiter rateLimiter, OutreachMetrics metrics) {
		this(props, rateLimiter, metrics, createRestTemplate(props.getChannel().getHttp().getTimeoutMs()));
	}

	HttpChannelProvider(OutreachProperties props, OutreachRateLimiter rateLimiter, OutreachMetrics metrics,
			RestTemplate rt) {
		this.props = props;
		this.rateLimiter = rateLimiter;
		this.metrics = metrics;
		this.rt = rt;
	}

	private static RestTemplate createRestTemplate(int timeoutMs) {
		SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
		factory.setConnectTimeout(timeoutMs);
		factory.setReadTimeout(timeoutMs);
		return new RestTemplate(factory);
	}

	@Override
	@Retry(name = "channelProvider")
	@CircuitBreaker(name = "channelProvider", fallbackMethod = "sendFallback")
	public ChannelResult send(String to, String templateId, Map<String, String> variables) {
		OutreachProperties.Channel.Http http = props.getChannel().getHttp();
		String apiKey = trim(http.getApiKey());
		if (apiKey.isEmpty()) {
			return ChannelResult.skipped("missing_config");
		}
		String destination = trim(to);
		String template = trim(templateId);
		if (destination.isEmpty() || template.isEmpty()) {
			return ChannelResult.skipped("invalid_input");
		}

		if (!rateLimiter.tryConsumeChannel()) {
			log.warn("Channel provider rate limit exceeded: template={}", template);
			return ChannelResult.fail("rate_limit_exceeded");
		}

		Map<String, String> params = normalize(variables);
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("destination", destination);
		payload.put("templateName", template);
		payload.put("campaignName", template);
		payload.put("params", params);
		payload.put("userName", params.getOrDefault("name", destination));
		String senderId = trim(http.getSenderId());
		if (!senderId.isEmpty()) {
			payload.put("sender", senderId);
			payload.put("senderId", senderId);
		}

		HttpHeaders headers = new HttpHeaders();
		headers.setContentType(MediaType.APPLICATION_JSON);
		headers.setBearerAuth(apiKey);
		headers.set("x-api-key", apiKey);

		String url = stripTrailingSlash(http.getBaseUrl()) + http.getSendPath();
		var timer = metrics.startChannelCallTimer();
		try {
			ResponseEntity<Map<String, Object>> resp = rt.exchange(url, HttpMethod.POST, new HttpEntity<>(payload, headers),
					new ParameterizedTypeReference<Map<String, Object>>() {});
			log.info("Channel send RESP: template={} statusCode={}", template, resp.getStatusCode().value());
			return ChannelResult.ok(resp.getStatusCode().value());
		} catch (HttpClientErrorException e) {
			log.warn("Channel send rejected: template={} statusCode={} body={}",
					template, e.getStatusCode().value(), e.getResponseBodyAsString());
			return ChannelResult.fail(e.getStatusCode().value(), "request_failed");
		} catch (ResourceAccessException e) {
			Throwable cause = e.getMostSpecificCause();
			if (cause instanceof ConnectException || cause instanceof UnknownHostException
					|| cause instanceof NoRouteToHostException) {
				log.warn("Channel unreachable (will be retried by Resilience4j): template={} error={}", template, cause.getMessage());
				throw new ChannelUnreachableException("Channel unreachable: " + cause.getMessage(), e);
			}
			log.warn("Channel send outcome unknown, not retried: template={} error={}", template, e.getMessage());
			return ChannelResult.fail("delivery_unknown");
		} catch (RuntimeException e) {
			log.warn("Channel send error (will be retried by Resilience4j): template={} error={}", template, e.getMessage());
			throw e;
		} finally {
			metrics.recordChannelCallTime(timer);
		}
	}

	/**
	 * Called when the circuit is open or retries are exhausted.
	 */
	public ChannelResult sendFallback(String to, String templateId, Map<String, String> variables, Throwable throwable) {
		String error = throwable != null && throwable.getMessage() != null ? throwable.getMessage() : "request_failed";
		log.warn("Channel provider fallback triggered: template={} error={}", templateId, error);
		return ChannelResult.fail(error);
	}

	static Map<String, String> normalize(Map<String, String> variables) {
		Map<String, String> out = new LinkedHashMap<>();
		if (variables == null) {
			return out;
		}
		variables.forEach((key, value) -> {
			String v = trim(value);
			if (!v.isEmpty()) {
				out.put(key, v);
			}
		});
		return out;
	}

	private static String trim(String value) {
		return value == null ? "" : value.trim();
	}

	private static String stripTrailingSlash(String url) {
		String value = trim(url);
		while (value.endsWith("/")) {
			value = value.substring(0, value.length() - 1);
		}
		return value;
	}
}
