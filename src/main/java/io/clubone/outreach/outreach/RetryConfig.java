package io.clubone.outreach.outreach;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Retry for tagging provider calls. Tagging is best-effort so the budget is small:
 * 3 attempts on client I/O and 5xx errors, 500ms doubling up to 4s.
 */
@Configuration
public class RetryConfig {

	private static final Logger log = LoggerFactory.getLogger(RetryConfig.class);

	@Bean
	public RetryTemplate taggingRetryTemplate() {
		RetryTemplate retryTemplate = new RetryTemplate();

		// 4xx answers are final
		SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(3,
			Map.of(HttpClientErrorException.class, false, RestClientException.class, true), true);
		retryTemplate.setRetryPolicy(retryPolicy);

		ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
		backOffPolicy.setInitialInterval(500);
		backOffPolicy.setMultiplier(2.0);
		backOffPolicy.setMaxInterval(4000);
		retryTemplate.setBackOffPolicy(backOffPolicy);

		retryTemplate.registerListener(new RetryListener() {
			@Override
			public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
					Throwable throwable) {
				log.warn("Tagging provider call failed (attempt {} of {}): {}",
					context.getRetryCount(), retryPolicy.getMaxAttempts(), throwable.getMessage());
			}

			@Override
			public <T, E extends Throwable> void onSuccess(RetryContext context, RetryCallback<T, E> callback,
					T result) {
				if (context.getRetryCount() > 0) {
					log.info("Tagging provider call succeeded after {} retries", context.getRetryCount());
				}
			}
		});

		return retryTemplate;
	}
}
