package uk.gegc.paperdigest.features.ai.infra.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.features.ai.application.ProgressReporter;
import uk.gegc.paperdigest.shared.config.AiRateLimitConfig;
import uk.gegc.paperdigest.shared.exception.AiServiceException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Client-side admission control for the completion service.
 * <p>
 * Keeps the timestamps of requests admitted during the last window. A caller is admitted once fewer than
 * {@code requestsPerMinute} timestamps remain in the window and at least {@code minIntervalMs} has elapsed
 * since the previous admission. After the server answers 429 the window is cleared and admission is
 * suspended until the announced cooldown has passed.
 * <p>
 * The check, the wait and the record happen under one monitor, so concurrent callers are serialized and
 * the quota cannot be overshot.
 */
@Component
@Slf4j
public class SlidingWindowRateLimiter {

    private final AiRateLimitConfig rateLimitConfig;
    private final ProgressReporter progressReporter;
    private final Clock clock;

    private final Deque<Instant> admitted = new ArrayDeque<>();
    private Instant blockedUntil;

    public SlidingWindowRateLimiter(AiRateLimitConfig rateLimitConfig,
                                    ProgressReporter progressReporter,
                                    Clock clock) {
        this.rateLimitConfig = rateLimitConfig;
        this.progressReporter = progressReporter;
        this.clock = clock;
    }

    /**
     * Blocks until a request may be sent and records its admission time.
     *
     * @return how long the caller waited
     */
    public synchronized Duration acquire() {
        Instant start = clock.instant();
        Duration window = Duration.ofMillis(rateLimitConfig.getWindowMs());
        int quota = Math.max(1, rateLimitConfig.getRequestsPerMinute());

        if (blockedUntil != null && start.isBefore(blockedUntil)) {
            Duration cooldown = Duration.between(start, blockedUntil);
            progressReporter.report(String.format("Rate limit exceeded. Waiting %d seconds...", ceilSeconds(cooldown)));
            sleep(cooldown);
        }
        blockedUntil = null;

        Instant now = clock.instant();
        evictExpired(now, window);
        while (admitted.size() >= quota) {
            Duration wait = window.minus(Duration.between(admitted.peekFirst(), now));
            if (!wait.isNegative() && !wait.isZero()) {
                log.info("Request quota of {} per window reached, waiting {} ms", quota, wait.toMillis());
                progressReporter.report(String.format("Rate limit reached, waiting %.1f seconds...", wait.toMillis() / 1000.0));
                sleep(wait);
            }
            now = clock.instant();
            evictExpired(now, window);
        }

        Instant last = admitted.peekLast();
        if (last != null) {
            Duration spacing = Duration.ofMillis(rateLimitConfig.getMinIntervalMs())
                    .minus(Duration.between(last, now));
            if (!spacing.isNegative() && !spacing.isZero()) {
                sleep(spacing);
                now = clock.instant();
            }
        }

        admitted.addLast(now);
        return Duration.between(start, now);
    }

    /**
     * Reacts to a 429 from the server: forgets the local window and refuses admission until the cooldown ends.
     */
    public synchronized void onServerThrottle(Duration retryAfter) {
        admitted.clear();
        blockedUntil = clock.instant().plus(retryAfter);
        log.warn("Server throttled requests, admission suspended until {}", blockedUntil);
    }

    public synchronized int admittedInWindow() {
        evictExpired(clock.instant(), Duration.ofMillis(rateLimitConfig.getWindowMs()));
        return admitted.size();
    }

    private void evictExpired(Instant now, Duration window) {
        while (!admitted.isEmpty() && Duration.between(admitted.peekFirst(), now).compareTo(window) >= 0) {
            admitted.pollFirst();
        }
    }

    private static long ceilSeconds(Duration duration) {
        return (duration.toMillis() + 999) / 1000;
    }

    /**
     * Sleep method that can be overridden in tests
     */
    protected void sleep(Duration duration) {
        try {
            // round up so a sub-millisecond remainder is not slept as zero
            long millis = duration.toMillis() + (duration.toNanosPart() % 1_000_000 > 0 ? 1 : 0);
            Thread.sleep(Math.max(1, millis));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AiServiceException("Interrupted while waiting for rate limit admission", ie);
        }
    }
}
