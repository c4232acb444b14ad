package io.clubone.outreach.outreach;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "clubone.outreach")
public class OutreachProperties {
	private int maxMessagesPerRun = 50;
	private int maxMessagesPerLead = 3;
	private Duration throttleWindow = Duration.ofDays(7);
	private Duration paymentLookback = Duration.ofDays(4);
	private Duration recentActivityWindow = Duration.ofHours(24);

	// Read limits, mirrors what the admin dashboard can render
	private int leadLoadLimit = 600;
	private int bookingLoadLimit = 600;
	private int paymentLoadLimit = 700;
	private int logReadLimit = 1400;
	private int upcomingLimit = 80;
	private int recentLimit = 140;
	private int failureLimit = 80;

	private Map<String, String> templates = new LinkedHashMap<>();
	private boolean strictTemplates = true;
	private Map<String, String> tags = new LinkedHashMap<>(Map.of(
			"quote_followup", "QuoteFollowupSent",
			"payment_reminder", "PaymentReminderSent",
			"reengagement", "Reengaged"));

	private Retry retry = new Retry();
	private Reservation reservation = new Reservation();
	private Channel channel = new Channel();
	private Tagging tagging = new Tagging();
	private Scheduling scheduling = new Scheduling();

	public int getMaxMessagesPerRun() {
		return maxMessagesPerRun;
	}

	public void setMaxMessagesPerRun(int maxMessagesPerRun) {
		this.maxMessagesPerRun = maxMessagesPerRun;
	}

	public int getMaxMessagesPerLead() {
		return maxMessagesPerLead;
	}

	public void setMaxMessagesPerLead(int maxMessagesPerLead) {
		this.maxMessagesPerLead = maxMessagesPerLead;
	}

	public Duration getThrottleWindow() {
		return throttleWindow;
	}

	public void setThrottleWindow(Duration throttleWindow) {
		this.throttleWindow = throttleWindow;
	}

	public Duration getPaymentLookback() {
		return paymentLookback;
	}

	public void setPaymentLookback(Duration paymentLookback) {
		this.paymentLookback = paymentLookback;
	}

	public Duration getRecentActivityWindow() {
		return recentActivityWindow;
	}

	public void setRecentActivityWindow(Duration recentActivityWindow) {
		this.recentActivityWindow = recentActivityWindow;
	}

	public int getLeadLoadLimit() {
		return leadLoadLimit;
	}

	public void setLeadLoadLimit(int leadLoadLimit) {
		this.leadLoadLimit = leadLoadLimit;
	}

	public int getBookingLoadLimit() {
		return bookingLoadLimit;
	}

	public void setBookingLoadLimit(int bookingLoadLimit) {
		this.bookingLoadLimit = bookingLoadLimit;
	}

	public int getPaymentLoadLimit() {
		return paymentLoadLimit;
	}

	public void setPaymentLoadLimit(int paymentLoadLimit) {
		this.paymentLoadLimit = paymentLoadLimit;
	}

	public int getLogReadLimit() {
		return logReadLimit;
	}

	public void setLogReadLimit(int logReadLimit) {
		this.logReadLimit = logReadLimit;
	}

	public int getUpcomingLimit() {
		return upcomingLimit;
	}

	public void setUpcomingLimit(int upcomingLimit) {
		this.upcomingLimit = upcomingLimit;
	}

	public int getRecentLimit() {
		return recentLimit;
	}

	public void setRecentLimit(int recentLimit) {
		this.recentLimit = recentLimit;
	}

	public int getFailureLimit() {
		return failureLimit;
	}

	public void setFailureLimit(int failureLimit) {
		this.failureLimit = failureLimit;
	}

	public Map<String, String> getTemplates() {
		return templates;
	}

	public void setTemplates(Map<String, String> templates) {
		this.templates = templates;
	}

	public boolean isStrictTemplates() {
		return strictTemplates;
	}

	public void setStrictTemplates(boolean strictTemplates) {
		this.strictTemplates = strictTemplates;
	}

	public Map<String, String> getTags() {
		return tags;
	}

	public void setTags(Map<String, String> tags) {
		this.tags = tags;
	}

	public Retry getRetry() {
		return retry;
	}

	public void setRetry(Retry retry) {
		this.retry = retry;
	}

	public Reservation getReservation() {
		return reservation;
	}

	public void setReservation(Reservation reservation) {
		this.reservation = reservation;
	}

	public Channel getChannel() {
		return channel;
	}

	public void setChannel(Channel channel) {
		this.channel = channel;
	}

	public Tagging getTagging() {
		return tagging;
	}

	public void setTagging(Tagging tagging) {
		this.tagging = tagging;
	}

	public Scheduling getScheduling() {
		return scheduling;
	}

	public void setScheduling(Scheduling scheduling) {
		this.scheduling = scheduling;
	}

	/**
	 * Re-opening policy for steps whose dispatch failed.
	 * The n-th failure waits backoff[n-1] (last entry repeats) before the step is eligible again.
	 */
	public static class Retry {
		private int maxAttempts = 3;
		private List<Duration> backoff = new ArrayList<>(List.of(
				Duration.ofMinutes(5), Duration.ofMinutes(15), Duration.ofMinutes(45)));

		public int getMaxAttempts() {
			return maxAttempts;
		}

		public void setMaxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
		}

		public List<Duration> getBackoff() {
			return backoff;
		}

		public void setBackoff(List<Duration> backoff) {
			this.backoff = backoff;
		}
	}

	public static class Reservation {
		private Duration gracePeriod = Duration.ofMinutes(30);

		public Duration getGracePeriod() {
			return gracePeriod;
		}

		public void setGracePeriod(Duration gracePeriod) {
			this.gracePeriod = gracePeriod;
		}
	}

	public static class Channel {
		private String strategy = "NOOP"; // NOOP | HTTP
		private Http http = new Http();

		public String getStrategy() {
			return strategy;
		}

		public void setStrategy(String strategy) {
			this.strategy = strategy;
		}

		public Http getHttp() {
			return http;
		}

		public void setHttp(Http http) {
			this.http = http;
		}

		public static class Http {
			private String baseUrl = "https://backend.aisensy.com";
			private String sendPath = "/campaign/t1/api/v2";
			private String apiKey = "";
			private String senderId = "";
			private int timeoutMs = 8000;

			public String getBaseUrl() {
				return baseUrl;
			}

			public void setBaseUrl(String baseUrl) {
				this.baseUrl = baseUrl;
			}

			public String getSendPath() {
				return sendPath;
			}

			public void setSendPath(String sendPath) {
				this.sendPath = sendPath;
			}

			public String getApiKey() {
				return apiKey;
			}

			public void setApiKey(String apiKey) {
				this.apiKey = apiKey;
			}

			public String getSenderId() {
				return senderId;
			}

			public void setSenderId(String senderId) {
				this.senderId = senderId;
			}

			public int getTimeoutMs() {
				return timeoutMs;
			}

			public void setTimeoutMs(int timeoutMs) {
				this.timeoutMs = timeoutMs;
			}
		}
	}

	public static class Tagging {
		private String strategy = "NOOP"; // NOOP | HTTP
		private Http http = new Http();

		public String getStrategy() {
			return strategy;
		}

		public void setStrategy(String strategy) {
			this.strategy = strategy;
		}

		public Http getHttp() {
			return http;
		}

		public void setHttp(Http http) {
			this.http = http;
		}

		public static class Http {
			private String baseUrl = "";
			private String audienceId = "";
			private String apiKey = "";
			private int timeoutMs = 8000;

			public String getBaseUrl() {
				return baseUrl;
			}

			public void setBaseUrl(String baseUrl) {
				this.baseUrl = baseUrl;
			}

			public String getAudienceId() {
				return audienceId;
			}

			public void setAudienceId(String audienceId) {
				this.audienceId = audienceId;
			}

			public String getApiKey() {
				return apiKey;
			}

			public void setApiKey(String apiKey) {
				this.apiKey = apiKey;
			}

			public int getTimeoutMs() {
				return timeoutMs;
			}

			public void setTimeoutMs(int timeoutMs) {
				this.timeoutMs = timeoutMs;
			}
		}
	}

	public static class Scheduling {
		private boolean enabled = false;
		private String cron = "0 0/15 * * * ?";

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public String getCron() {
			return cron;
		}

		public void setCron(String cron) {
			this.cron = cron;
		}
	}
}
