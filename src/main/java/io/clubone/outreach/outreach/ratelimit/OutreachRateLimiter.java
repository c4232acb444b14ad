package io.clubone.outreach.outreach.ratelimit;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Rate limiter for outreach operations.
 * Protects the messaging provider and the admin surface.
 */
@Component
public class OutreachRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(OutreachRateLimiter.class);

    // Channel provider: 20 sends per second
    private final Bucket channelBucket;

    // Admin single-lead trigger: 30 per minute
    private final Bucket manualTriggerBucket;

    // Run launches: 12 per hour
    private final Bucket runBucket;

    public OutreachRateLimiter() {
        this.channelBucket = Bucket.builder()
            .addLimit(Bandwidth.classic(20, Refill.intervally(20, Duration.ofSeconds(1))))
            .build();

        this.manualTriggerBucket = Bucket.builder()
            .addLimit(Bandwidth.classic(30, Refill.intervally(30, Duration.ofMinutes(1))))
            .build();

        this.runBucket = Bucket.builder()
            .addLimit(Bandwidth.classic(12, Refill.intervally(12, Duration.ofHours(1))))
            .build();
    }

    /**
     * @return true if token consumed, false if rate limit exceeded
     */
    public boolean tryConsumeChannel() {
        boolean consumed = channelBucket.tryConsume(1);
        if (!consumed) {
            log.warn("Channel provider rate limit exceeded. Available tokens: {}", channelBucket.getAvailableTokens());
        }
        return consumed;
    }

    public boolean tryConsumeManualTrigger() {
        boolean consumed = manualTriggerBucket.tryConsume(1);
        if (!consumed) {
            log.warn("Manual outreach rate limit exceeded. Available tokens: {}", manualTriggerBucket.getAvailableTokens());
        }
        return consumed;
    }

    public boolean tryConsumeRun() {
        boolean consumed = runBucket.tryConsume(1);
        if (!consumed) {
            log.warn("Outreach run rate limit exceeded. Available tokens: {}", runBucket.getAvailableTokens());
        }
        return consumed;
    }

    public long getRemainingChannelTokens() {
        return channelBucket.getAvailableTokens();
    }
}
