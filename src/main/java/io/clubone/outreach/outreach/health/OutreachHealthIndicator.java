package io.clubone.outreach.outreach.health;

import io.clubone.outreach.outreach.OutreachProperties;
import io.clubone.outreach.outreach.failure.AutomationFailureRecorder;
import io.clubone.outreach.outreach.model.Opportunity;
import io.clubone.outreach.outreach.provider.ProviderFactory;
import io.clubone.outreach.repo.OutreachRunRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Checks data store connectivity, open automation failures and channel configuration.
 */
@Component
public class OutreachHealthIndicator implements HealthIndicator {

    static final int OPEN_FAILURE_THRESHOLD = 100;

    private final JdbcTemplate jdbc;
    private final OutreachProperties props;
    private final AutomationFailureRecorder failureRecorder;
    private final ProviderFactory providers;
    private final OutreachRunRepository runRepository;

    public OutreachHealthIndicator(JdbcTemplate jdbc, OutreachProperties props, AutomationFailureRecorder failureRecorder,
                                   ProviderFactory providers, OutreachRunRepository runRepository) {
        this.jdbc = jdbc;
        this.props = props;
        this.failureRecorder = failureRecorder;
        this.providers = providers;
        this.runRepository = runRepository;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            jdbc.queryForObject("SELECT 1", Integer.class);
            details.put("database", Map.of("status", "UP", "message", "Connected"));
        } catch (Exception e) {
            details.put("database", Map.of("status", "DOWN", "error", String.valueOf(e.getMessage())));
            return Health.down().withDetails(details).build();
        }

        details.put("channel", Map.of(
            "strategy", props.getChannel().getStrategy(),
            "configured", providers.isChannelConfigured()));

        boolean healthy = true;
        int open = failureRecorder.openCount(Opportunity.failureEventPattern());
        details.put("automationFailures", Map.of("open", open, "status", open > OPEN_FAILURE_THRESHOLD ? "WARNING" : "OK"));
        if (open > OPEN_FAILURE_THRESHOLD) {
            details.put("failureWarning", "Open automation failures exceed threshold: " + open);
            healthy = false;
        }

        try {
            details.put("activeRuns", runRepository.countRunning());
        } catch (Exception e) {
            details.put("activeRuns", "CHECK_FAILED");
        }

        return (healthy ? Health.up() : Health.down()).withDetails(details).build();
    }
}
