package io.clubone.outreach.outreach.health;

import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.failure.AutomationFailureRecorder;
import io.clubone.outreach.outreach.provider.ProviderFactory;
import io.clubone.outreach.repo.OutreachRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutreachHealthIndicatorTest {

	@Mock
	private JdbcTemplate jdbc;

	@Mock
	private AutomationFailureRecorder failureRecorder;

	@Mock
	private ProviderFactory providers;

	@Mock
	private OutreachRunRepository runRepository;

	private OutreachHealthIndicator indicator;

	@BeforeEach
	void setUp() {
		indicator = new OutreachHealthIndicator(jdbc, new OutreachProperties(), failureRecorder, providers, runRepository);
	}

	@Test
	void upWhenDatabaseReachableAndFailuresBelowThreshold() {
		when(jdbc.queryForObject("SELECT 1", Integer.class)).thenReturn(1);
		when(providers.isChannelConfigured()).thenReturn(true);
		when(failureRecorder.openCount(anyString())).thenReturn(4);
		when(runRepository.countRunning()).thenReturn(0);

		Health health = indicator.health();

		assertEquals(Status.UP, health.getStatus());
		assertEquals(0, health.getDetails().get("activeRuns"));
		assertFalse(health.getDetails().containsKey("failureWarning"));
	}

	@Test
	void downWhenOpenFailuresExceedThreshold() {
		when(jdbc.queryForObject("SELECT 1", Integer.class)).thenReturn(1);
		when(failureRecorder.openCount(anyString())).thenReturn(OutreachHealthIndicator.OPEN_FAILURE_THRESHOLD + 1);
		when(runRepository.countRunning()).thenThrow(new DataAccessResourceFailureException("gone"));

		Health health = indicator.health();

		assertEquals(Status.DOWN, health.getStatus());
		assertTrue(health.getDetails().containsKey("failureWarning"));
		assertEquals("CHECK_FAILED", health.getDetails().get("activeRuns"));
	}

	@Test
	void downWithoutFurtherChecksWhenDatabaseUnreachable() {
		when(jdbc.queryForObject("SELECT 1", Integer.class)).thenThrow(new DataAccessResourceFailureException("refused"));

		Health health = indicator.health();

		assertEquals(Status.DOWN, health.getStatus());
		verifyNoInteractions(failureRecorder, runRepository);
	}
}
