package uk.gegc.paperdigest.features.ai.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.paperdigest.features.ai.application.CompletionDispatcher;
import uk.gegc.paperdigest.features.ai.application.CompletionModel;
import uk.gegc.paperdigest.features.ai.application.CompletionModelProvider;
import uk.gegc.paperdigest.features.ai.application.ProgressReporter;
import uk.gegc.paperdigest.features.ai.domain.model.CompletionRequest;
import uk.gegc.paperdigest.features.ai.infra.ratelimit.SlidingWindowRateLimiter;
import uk.gegc.paperdigest.shared.config.AiRateLimitConfig;
import uk.gegc.paperdigest.shared.exception.AiServiceException;
import uk.gegc.paperdigest.shared.exception.CompletionAuthException;
import uk.gegc.paperdigest.shared.exception.CompletionBadRequestException;
import uk.gegc.paperdigest.shared.exception.RateLimitExceededException;
import uk.gegc.paperdigest.shared.exception.TransientCompletionException;

import java.time.Duration;

@Service
@Slf4j
@RequiredArgsConstructor
public class RateLimitedCompletionDispatcher implements CompletionDispatcher {

    static final String DISPATCH_METRIC = "completion.dispatch";
    static final String RETRY_METRIC = "completion.retries";

    private final CompletionModelProvider modelProvider;
    private final SlidingWindowRateLimiter rateLimiter;
    private final ProgressReporter progressReporter;
    private final AiRateLimitConfig rateLimitConfig;
    private final MeterRegistry meterRegistry;

    @Override
    public String dispatch(CompletionRequest request) {
        CompletionModel model = modelProvider.forTask(request.taskType());
        int maxAttempts = Math.max(1, rateLimitConfig.getMaxAttempts());
        int attempt = 0;

        while (true) {
            attempt++;
            Duration waited = rateLimiter.acquire();
            if (!waited.isZero()) {
                log.debug("Admitted {} after waiting {} ms", request.describe(), waited.toMillis());
            }
            progressReporter.report("Making API request (" + request.describe() + ")...");

            try {
                String completion = model.complete(request.prompt());
                log.debug("Completion for {} returned {} characters", request.describe(), completion.length());
                recordOutcome(request, "success");
                return completion;

            } catch (RateLimitExceededException e) {
                long retryAfter = e.getRetryAfterSeconds();
                log.warn("Server rate limit hit for {}, cooling down for {} s", request.describe(), retryAfter);
                rateLimiter.onServerThrottle(Duration.ofSeconds(retryAfter));
                progressReporter.report(String.format("Rate limit exceeded. Waiting %d seconds...", retryAfter));
                sleepForRateLimit(retryAfter * 1000);
                recordOutcome(request, "rate_limited");
                throw new RateLimitExceededException("Rate limit exceeded. Please try again in a moment.", retryAfter);

            } catch (CompletionAuthException e) {
                log.error("Completion service rejected the API credential");
                recordOutcome(request, "auth_error");
                throw e;

            } catch (CompletionBadRequestException e) {
                log.error("Completion service rejected {}: {}", request.describe(), e.getResponseBody());
                recordOutcome(request, "bad_request");
                throw e;

            } catch (TransientCompletionException e) {
                if (attempt >= maxAttempts) {
                    log.error("Giving up on {} after {} attempts: {}", request.describe(), attempt, e.getMessage());
                    recordOutcome(request, "transient_failure");
                    throw e;
                }
                retryAfterBackoff(request, attempt, maxAttempts, e);

            } catch (AiServiceException e) {
                recordOutcome(request, "error");
                throw e;

            } catch (RuntimeException e) {
                TransientCompletionException wrapped =
                        new TransientCompletionException("Unexpected completion failure: " + e.getMessage(), e);
                if (attempt >= maxAttempts) {
                    log.error("Giving up on {} after {} attempts", request.describe(), attempt, e);
                    recordOutcome(request, "transient_failure");
                    throw wrapped;
                }
                retryAfterBackoff(request, attempt, maxAttempts, wrapped);
            }
        }
    }

    private void retryAfterBackoff(CompletionRequest request, int attempt, int maxAttempts, TransientCompletionException e) {
        long delayMs = calculateBackoffDelay(attempt);
        log.warn("Attempt {}/{} for {} failed ({}), retrying in {} ms",
                attempt, maxAttempts, request.describe(), e.getMessage(), delayMs);
        progressReporter.report(String.format("Request failed, retrying in %d seconds...", delayMs / 1000));
        Counter.builder(RETRY_METRIC)
                .tag("task", request.taskType().getKey())
                .register(meterRegistry)
                .increment();
        sleepForRateLimit(delayMs);
    }

    /**
     * Delay before retry number {@code attempt}: base delay doubled per attempt already made.
     */
    long calculateBackoffDelay(int attempt) {
        return rateLimitConfig.getBaseDelayMs() * (1L << Math.min(attempt, 20));
    }

    private void recordOutcome(CompletionRequest request, String outcome) {
        Counter.builder(DISPATCH_METRIC)
                .tag("task", request.taskType().getKey())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Sleep method that can be overridden in tests
     */
    protected void sleepForRateLimit(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AiServiceException("Interrupted during rate limit delay", ie);
        }
    }
}
