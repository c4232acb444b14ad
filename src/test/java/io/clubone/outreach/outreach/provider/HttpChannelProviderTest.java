package io.clubone.outreach.outreach.provider;

import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.OutreachTestSupport;
import io.clubone.outreach.outreach.metrics.OutreachMetrics;
import io.clubone.outreach.outreach.ratelimit.OutreachRateLimiter;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class HttpChannelProviderTest {

	private static final String URL = "https://campaign.example/campaign/t1/api/v2";

	private OutreachProperties props;
	private MockRestServiceServer server;
	private HttpChannelProvider provider;

	@BeforeEach
	void setUp() {
		props = OutreachTestSupport.properties();
		props.getChannel().setStrategy("HTTP");
		props.getChannel().getHttp().setBaseUrl("https://campaign.example/");
		props.getChannel().getHttp().setApiKey("key-1");
		props.getChannel().getHttp().setSenderId("clubone");
		RestTemplate rt = new RestTemplate();
		server = MockRestServiceServer.bindTo(rt).build();
		provider = new HttpChannelProvider(props, new OutreachRateLimiter(),
			new OutreachMetrics(new SimpleMeterRegistry(), new JdbcTemplate()), rt);
	}

	@Test
	void postsTemplatePayloadWithCredentials() {
		server.expect(requestTo(URL))
			.andExpect(method(HttpMethod.POST))
			.andExpect(header("x-api-key", "key-1"))
			.andExpect(header("Authorization", "Bearer key-1"))
			.andExpect(jsonPath("$.destination").value("+919800000001"))
			.andExpect(jsonPath("$.templateName").value("quote_followup_1"))
			.andExpect(jsonPath("$.campaignName").value("quote_followup_1"))
			.andExpect(jsonPath("$.userName").value("Asha"))
			.andExpect(jsonPath("$.senderId").value("clubone"))
			.andExpect(jsonPath("$.params.destination").value("Bali"))
			.andExpect(jsonPath("$.params.start_date").doesNotExist())
			.andRespond(withSuccess("{\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

		Map<String, String> vars = new LinkedHashMap<>();
		vars.put("name", "Asha");
		vars.put("destination", "Bali");
		vars.put("start_date", " ");
		ChannelResult result = provider.send("+919800000001", "quote_followup_1", vars);

		assertTrue(result.isOk());
		assertEquals(200, result.getStatus());
		server.verify();
	}

	@Test
	void clientErrorIsFinalFailure() {
		server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST));

		ChannelResult result = provider.send("+919800000001", "quote_followup_1", Map.of());

		assertFalse(result.isOk());
		assertFalse(result.isSkipped());
		assertEquals(400, result.getStatus());
		assertEquals("request_failed", result.getError());
	}

	@Test
	void serverErrorPropagatesForRetry() {
		server.expect(requestTo(URL)).andRespond(withServerError());

		assertThrows(HttpServerErrorException.class,
			() -> provider.send("+919800000001", "quote_followup_1", Map.of()));
	}

	@Test
	void readTimeoutIsReportedOnceAndNotRetried() {
		server.expect(ExpectedCount.once(), requestTo(URL)).andRespond(request -> {
			throw new SocketTimeoutException("Read timed out");
		});

		ChannelResult result = Retry.decorateSupplier(channelRetry(),
			() -> provider.send("+919800000001", "quote_followup_1", Map.of())).get();

		assertFalse(result.isOk());
		assertFalse(result.isSkipped());
		assertEquals("delivery_unknown", result.getError());
		server.verify();
	}

	@Test
	void refusedConnectionIsRetried() {
		server.expect(ExpectedCount.times(2), requestTo(URL)).andRespond(request -> {
			throw new ConnectException("Connection refused");
		});
		server.expect(requestTo(URL)).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

		ChannelResult result = Retry.decorateSupplier(channelRetry(),
			() -> provider.send("+919800000001", "quote_followup_1", Map.of())).get();

		assertTrue(result.isOk());
		server.verify();
	}

	@Test
	void refusedConnectionSurfacesAsUnreachable() {
		server.expect(requestTo(URL)).andRespond(request -> {
			throw new ConnectException("Connection refused");
		});

		assertThrows(ChannelUnreachableException.class,
			() -> provider.send("+919800000001", "quote_followup_1", Map.of()));
	}

	@Test
	void missingApiKeyOrInputIsSkippedWithoutCalling() {
		ChannelResult noPhone = provider.send(" ", "quote_followup_1", Map.of());
		props.getChannel().getHttp().setApiKey(" ");
		ChannelResult noKey = provider.send("+919800000001", "quote_followup_1", Map.of());

		assertTrue(noPhone.isSkipped());
		assertEquals("invalid_input", noPhone.getError());
		assertTrue(noKey.isSkipped());
		assertEquals("missing_config", noKey.getError());
		server.verify();
	}

	// same retry policy as the channelProvider instance in application.yml
	private static Retry channelRetry() {
		return Retry.of("channelProvider", RetryConfig.custom()
			.maxAttempts(3)
			.waitDuration(Duration.ofMillis(1))
			.retryExceptions(HttpServerErrorException.class, ChannelUnreachableException.class)
			.build());
	}

	@Test
	void fallbackTurnsExhaustionIntoFailure() {
		ChannelResult result = provider.sendFallback("+919800000001", "quote_followup_1", Map.of(),
			new IllegalStateException("CircuitBreaker 'channelProvider' is OPEN"));

		assertFalse(result.isOk());
		assertEquals("CircuitBreaker 'channelProvider' is OPEN", result.getError());
	}
}
