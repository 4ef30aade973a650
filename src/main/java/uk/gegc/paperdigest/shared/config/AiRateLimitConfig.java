package uk.gegc.paperdigest.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the completion rate limiter and retry behavior
 */
@Component
@ConfigurationProperties(prefix = "ai.rate-limit")
@Data
public class AiRateLimitConfig {

    /**
     * Requests admitted per sliding window (the provider's per-minute quota)
     */
    private int requestsPerMinute = 60;

    /**
     * Length of the sliding window in milliseconds
     */
    private long windowMs = 60_000;

    /**
     * Minimum spacing between two admitted requests in milliseconds
     */
    private long minIntervalMs = 1000;

    /**
     * Total attempts for one request when the failure is transient
     */
    private int maxAttempts = 3;

    /**
     * Base delay in milliseconds for exponential backoff (delay = base * 2^attempt)
     */
    private long baseDelayMs = 1000;

    /**
     * Cooldown applied after a 429 response that carries no Retry-After header
     */
    private long defaultRetryAfterSeconds = 60;

    /**
     * Minimum wall time between two progress emissions
     */
    private long progressThrottleMs = 500;
}
