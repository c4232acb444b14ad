package io.clubone.outreach.outreach.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Prometheus-compatible meters for outreach runs and provider calls.
 */
@Component
public class OutreachMetrics {

    private static final Logger log = LoggerFactory.getLogger(OutreachMetrics.class);

    private final Timer runExecutionTime;
    private final Timer channelCallTime;
    private final MeterRegistry registry;

    public OutreachMetrics(MeterRegistry registry, JdbcTemplate jdbc) {
        this.registry = registry;

        this.runExecutionTime = Timer.builder("outreach.run.execution.time")
            .description("Total outreach run execution time")
            .register(registry);

        this.channelCallTime = Timer.builder("outreach.channel.call.time")
            .description("Time for a channel provider send")
            .register(registry);

        Gauge.builder("outreach.failures.open", () -> getOpenFailures(jdbc))
            .description("Open automation failures for outreach")
            .register(registry);
    }

    public void recordSent(String type) {
        Counter.builder("outreach.messages.sent")
            .description("Outreach messages sent")
            .tag("type", type != null ? type : "unknown")
            .register(registry)
            .increment();
    }

    public void recordSkipped(String reason) {
        Counter.builder("outreach.messages.skipped")
            .description("Outreach opportunities skipped")
            .tag("reason", reason != null ? reason : "unknown")
            .register(registry)
            .increment();
    }

    public void recordFailed(String reason) {
        Counter.builder("outreach.messages.failed")
            .description("Outreach dispatches failed")
            .tag("reason", reason != null ? reason : "unknown")
            .register(registry)
            .increment();
    }

    public Timer.Sample startRunTimer() {
        return Timer.start(registry);
    }

    public Timer.Sample startChannelCallTimer() {
        return Timer.start(registry);
    }

    public void recordRunExecutionTime(Timer.Sample sample) {
        sample.stop(runExecutionTime);
    }

    public void recordChannelCallTime(Timer.Sample sample) {
        sample.stop(channelCallTime);
    }

    private int getOpenFailures(JdbcTemplate jdbc) {
        try {
            Integer count = jdbc.queryForObject(
                "SELECT COUNT(1) FROM automation_failures WHERE status = 'failed' AND event LIKE ?",
                Integer.class,
                "crm_outreach:%"
            );
            return count != null ? count : 0;
        } catch (Exception e) {
            log.debug("Failed to get open failure count", e);
            return 0;
        }
    }
}
