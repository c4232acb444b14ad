package io.clubone.outreach.outreach.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.crm.CrmRepository;
import io.clubone.outreach.outreach.failure.AutomationFailureRecorder;
import io.clubone.outreach.outreach.ledger.OutreachLogRepository;
import io.clubone.outreach.outreach.metrics.OutreachMetrics;
import io.clubone.outreach.outreach.model.DispatchOutcome;
import io.clubone.outreach.outreach.model.Lead;
import io.clubone.outreach.outreach.model.Opportunity;
import io.clubone.outreach.outreach.model.OutreachEvent;
import io.clubone.outreach.outreach.model.OutreachLogEntry;
import io.clubone.outreach.outreach.provider.ChannelResult;
import io.clubone.outreach.outreach.provider.ProviderFactory;
import io.clubone.outreach.outreach.provider.TaggingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends one reserved opportunity and writes its outcome to the outreach log.
 * Only the channel result decides the outcome; tagging and lead bookkeeping are best-effort.
 */
@Component
public class OutreachDispatcher {

	private static final Logger log = LoggerFactory.getLogger(OutreachDispatcher.class);

	private final ProviderFactory providers;
	private final OutreachLogRepository logRepository;
	private final AutomationFailureRecorder failureRecorder;
	private final CrmRepository crm;
	private final OutreachMetrics metrics;
	private final OutreachProperties props;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	public OutreachDispatcher(ProviderFactory providers, OutreachLogRepository logRepository,
			AutomationFailureRecorder failureRecorder, CrmRepository crm, OutreachMetrics metrics,
			OutreachProperties props, ObjectMapper objectMapper, Clock clock) {
		this.providers = providers;
		this.logRepository = logRepository;
		this.failureRecorder = failureRecorder;
		this.crm = crm;
		this.metrics = metrics;
		this.props = props;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	/**
	 * @param attempt 1-based attempt number of this dedup key
	 */
	public DispatchOutcome dispatch(Opportunity opportunity, int attempt, String runId) {
		Lead lead = opportunity.getLead();

		if (lead.getCustomerPhone() == null) {
			writeLog(opportunity, OutreachEvent.SKIPPED, "Outreach skipped: phone missing", Map.of("runId", nullSafe(runId)));
			metrics.recordSkipped("phone_missing");
			return DispatchOutcome.SKIPPED;
		}
		if (!opportunity.hasTemplate()) {
			writeLog(opportunity, OutreachEvent.SKIPPED, "Outreach skipped: template missing", Map.of("runId", nullSafe(runId)));
			metrics.recordSkipped("template_missing");
			return DispatchOutcome.SKIPPED;
		}

		ChannelResult result;
		try {
			result = providers.channel().send(lead.getCustomerPhone(), opportunity.getTemplate(), variables(opportunity));
		} catch (RuntimeException e) {
			log.warn("Channel provider raised: dedupKey={} error={}", opportunity.getDedupKey(), e.getMessage());
			result = ChannelResult.fail(e.getMessage() != null ? e.getMessage() : "send_failed");
		}

		if (!result.isOk()) {
			String error = result.getError() != null ? result.getError() : "send_failed";
			Map<String, Object> meta = new LinkedHashMap<>();
			meta.put("error", error);
			meta.put("attempt", attempt);
			meta.put("runId", nullSafe(runId));
			writeLog(opportunity, OutreachEvent.FAILED, "Outreach failed", meta);
			failureRecorder.record(lead.getId(), bookingRef(opportunity), opportunity.getDedupKey(),
				"outreach_channel:" + error, attempt, failurePayload(opportunity));
			metrics.recordFailed(error);
			log.warn("Outreach dispatch failed: dedupKey={} attempt={} error={}", opportunity.getDedupKey(), attempt, error);
			return DispatchOutcome.FAILED;
		}

		Map<String, Object> sentMeta = new LinkedHashMap<>();
		sentMeta.put("template", opportunity.getTemplate());
		sentMeta.put("runId", nullSafe(runId));
		writeLog(opportunity, OutreachEvent.SENT, "Outreach sent", sentMeta);
		metrics.recordSent(opportunity.getType().getCode());
		log.info("Outreach sent: dedupKey={} template={}", opportunity.getDedupKey(), opportunity.getTemplate());

		tag(opportunity);

		if (!crm.recordOutreach(lead, Instant.now(clock))) {
			logRepository.append(entry(opportunity, OutreachEvent.BOOKKEEPING_SKIPPED,
				"Lead outreach metadata update skipped", null, false));
			log.warn("Lead outreach bookkeeping not written: leadId={}", lead.getId());
		}
		return DispatchOutcome.SENT;
	}

	private void tag(Opportunity opportunity) {
		Lead lead = opportunity.getLead();
		if (lead.getCustomerEmail() == null) {
			return;
		}
		String tag = props.getTags().getOrDefault(opportunity.getType().getCode(), opportunity.getType().getCode());
		TaggingResult tagging;
		try {
			tagging = providers.tagging().upsertContact(lead.getCustomerEmail(), lead.getCustomerPhone(),
				lead.getCustomerName(), List.of(tag));
		} catch (RuntimeException e) {
			tagging = TaggingResult.fail(e.getMessage() != null ? e.getMessage() : "tagging_failed");
		}
		if (tagging.isOk() || tagging.isSkipped()) {
			return;
		}
		String error = tagging.getError() != null ? tagging.getError() : "tagging_failed";
		writeLog(opportunity, OutreachEvent.TAGGING_FAILED, "Contact tagging failed", Map.of("error", error));
		failureRecorder.record(lead.getId(), bookingRef(opportunity), opportunity.getDedupKey() + ":tagging",
			"outreach_tagging:" + error, 1, failurePayload(opportunity));
		log.warn("Contact tagging failed, send stands: dedupKey={} error={}", opportunity.getDedupKey(), error);
	}

	/**
	 * Personalisation variables for the channel template.
	 */
	public static Map<String, String> variables(Opportunity opportunity) {
		Lead lead = opportunity.getLead();
		Map<String, String> vars = new LinkedHashMap<>();
		vars.put("name", orDefault(lead.getCustomerName(), "Traveler"));
		vars.put("destination", orDefault(lead.getDestination(), "your trip"));
		vars.put("start_date", orDefault(lead.getTravelStart(), ""));
		vars.put("end_date", orDefault(lead.getTravelEnd(), ""));
		vars.put("lead_id", orDefault(lead.getLeadCode(), lead.getId()));
		vars.put("payment_link", opportunity.getPayment() != null ? orDefault(opportunity.getPayment().getPaymentLink(), "") : "");
		vars.put("booking_id", orDefault(bookingRef(opportunity), ""));
		return vars;
	}

	private void writeLog(Opportunity opportunity, OutreachEvent event, String message, Map<String, Object> meta) {
		Map<String, Object> full = new LinkedHashMap<>();
		full.put("type", opportunity.getType().getCode());
		full.put("step", opportunity.getStep().getCode());
		full.putAll(meta);
		logRepository.append(entry(opportunity, event, message, full, true));
	}

	private OutreachLogEntry entry(Opportunity opportunity, OutreachEvent event, String message,
			Map<String, Object> meta, boolean withKey) {
		OutreachLogEntry entry = new OutreachLogEntry();
		entry.setEvent(event);
		entry.setLeadId(opportunity.getLead().getId());
		if (withKey) {
			entry.setDedupKey(opportunity.getDedupKey());
			entry.setType(opportunity.getType());
			entry.setStep(opportunity.getStep());
		}
		entry.setMessage(message);
		entry.setMeta(toJson(meta));
		entry.setCreatedAt(Instant.now(clock));
		return entry;
	}

	private static Map<String, Object> failurePayload(Opportunity opportunity) {
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("lead_id", opportunity.getLead().getId());
		payload.put("type", opportunity.getType().getCode());
		payload.put("step", opportunity.getStep().getCode());
		return payload;
	}

	private static String bookingRef(Opportunity opportunity) {
		return opportunity.getBooking() != null ? opportunity.getBooking().getDisplayRef() : null;
	}

	private String toJson(Map<String, Object> meta) {
		if (meta == null) {
			return null;
		}
		try {
			return objectMapper.writeValueAsString(meta);
		} catch (JsonProcessingException e) {
			log.debug("Log meta not serializable: error={}", e.getMessage());
			return null;
		}
	}

	private static String orDefault(String value, String fallback) {
		return value != null && !value.isBlank() ? value : fallback;
	}

	private static String nullSafe(String value) {
		return value != null ? value : "";
	}
}
