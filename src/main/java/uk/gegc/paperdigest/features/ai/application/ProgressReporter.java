package uk.gegc.paperdigest.features.ai.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.shared.config.AiRateLimitConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Forwards status updates to the registered {@link ProgressListener}, at most one per throttle interval
 * of wall time. An update arriving inside the interval is held as pending and replaced by any later one;
 * the next update after the interval supersedes it. A completion update (progress of 1.0 or more) is always
 * delivered at once, preceded by the pending update if there is one.
 */
@Component
@Slf4j
public class ProgressReporter {

    private static final ProgressListener LOGGING_LISTENER = (message, progress) -> {
        if (progress != null) {
            log.info("[Progress {}%] {}", Math.round(progress * 100), message);
        } else {
            log.info("[Progress] {}", message);
        }
    };

    private final Clock clock;
    private final Duration throttle;
    private volatile ProgressListener listener = LOGGING_LISTENER;
    private Instant lastEmission;
    private String pendingMessage;
    private Double pendingProgress;

    public ProgressReporter(AiRateLimitConfig rateLimitConfig, Clock clock) {
        this.clock = clock;
        this.throttle = Duration.ofMillis(Math.max(0, rateLimitConfig.getProgressThrottleMs()));
    }

    public void setListener(ProgressListener listener) {
        this.listener = listener != null ? listener : LOGGING_LISTENER;
    }

    public void report(String message) {
        report(message, null);
    }

    /**
     * @return {@code true} if the update reached the listener, {@code false} if it is held as pending
     */
    public synchronized boolean report(String message, Double progress) {
        Instant now = clock.instant();
        boolean completion = progress != null && progress >= 1.0;
        boolean throttled = lastEmission != null && Duration.between(lastEmission, now).compareTo(throttle) < 0;

        if (completion) {
            if (pendingMessage != null) {
                emit(pendingMessage, pendingProgress);
            }
        } else if (throttled) {
            log.trace("Progress update held: {}", message);
            pendingMessage = message;
            pendingProgress = progress;
            return false;
        }

        clearPending();
        lastEmission = now;
        emit(message, progress);
        return true;
    }

    private void emit(String message, Double progress) {
        try {
            listener.onProgress(message, progress);
        } catch (RuntimeException e) {
            // a failing observer must not break the request it observes
            log.warn("Progress listener failed for '{}': {}", message, e.getMessage());
        }
    }

    private void clearPending() {
        pendingMessage = null;
        pendingProgress = null;
    }
}
