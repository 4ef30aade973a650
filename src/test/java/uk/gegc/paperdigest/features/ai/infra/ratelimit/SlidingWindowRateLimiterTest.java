package uk.gegc.paperdigest.features.ai.infra.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.paperdigest.features.ai.application.ProgressReporter;
import uk.gegc.paperdigest.shared.config.AiRateLimitConfig;
import uk.gegc.paperdigest.testsupport.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SlidingWindowRateLimiter")
class SlidingWindowRateLimiterTest {

    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private MutableClock clock;
    private AiRateLimitConfig config;

    // Advances the test clock instead of blocking
    private static class ClockAdvancingLimiter extends SlidingWindowRateLimiter {
        private final MutableClock clock;
        private final List<Duration> sleeps = new ArrayList<>();

        ClockAdvancingLimiter(AiRateLimitConfig config, MutableClock clock) {
            super(config, new ProgressReporter(config, clock), clock);
            this.clock = clock;
        }

        @Override
        protected void sleep(Duration duration) {
            sleeps.add(duration);
            clock.advance(duration);
        }

        Instant admit() {
            acquire();
            return clock.instant();
        }
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        config = new AiRateLimitConfig();
    }

    @Test
    @DisplayName("acquire: first request is admitted immediately")
    void acquire_firstRequest_noWait() {
        ClockAdvancingLimiter limiter = new ClockAdvancingLimiter(config, clock);

        Duration waited = limiter.acquire();

        assertThat(waited).isZero();
        assertThat(limiter.sleeps).isEmpty();
        assertThat(limiter.admittedInWindow()).isEqualTo(1);
    }

    @Test
    @DisplayName("acquire: consecutive requests are spaced by the minimum interval")
    void acquire_consecutiveRequests_respectMinInterval() {
        ClockAdvancingLimiter limiter = new ClockAdvancingLimiter(config, clock);

        Instant first = limiter.admit();
        clock.advance(Duration.ofMillis(300));
        Instant second = limiter.admit();

        assertThat(Duration.between(first, second)).isGreaterThanOrEqualTo(Duration.ofMillis(1000));
        assertThat(limiter.sleeps).containsExactly(Duration.ofMillis(700));
    }

    @Test
    @DisplayName("acquire: no spacing wait once the interval has already passed")
    void acquire_intervalElapsed_noWait() {
        ClockAdvancingLimiter limiter = new ClockAdvancingLimiter(config, clock);

        limiter.acquire();
        clock.advance(Duration.ofSeconds(5));
        Duration waited = limiter.acquire();

        assertThat(waited).isZero();
    }

    @Test
    @DisplayName("acquire: the 61st of 61 back-to-back calls waits until 60s after the first")
    void acquire_sixtyFirstCall_delayedUntilWindowPasses() {
        ClockAdvancingLimiter limiter = new ClockAdvancingLimiter(config, clock);

        List<Instant> admissions = new ArrayList<>();
        for (int i = 0; i < 61; i++) {
            admissions.add(limiter.admit());
        }

        assertThat(Duration.between(admissions.get(0), admissions.get(60)))
                .isGreaterThanOrEqualTo(Duration.ofSeconds(60));
        for (int i = 1; i < admissions.size(); i++) {
            assertThat(Duration.between(admissions.get(i - 1), admissions.get(i)))
                    .isGreaterThanOrEqualTo(Duration.ofMillis(config.getMinIntervalMs()));
        }
    }

    @Test
    @DisplayName("acquire: with no spacing a full window blocks for exactly the remaining window")
    void acquire_fullWindowWithoutSpacing_waitsForOldestToExpire() {
        config.setMinIntervalMs(0);
        ClockAdvancingLimiter limiter = new ClockAdvancingLimiter(config, clock);

        for (int i = 0; i < 60; i++) {
            limiter.acquire();
        }
        assertThat(limiter.sleeps).isEmpty();
        assertThat(limiter.admittedInWindow()).isEqualTo(60);

        clock.advance(Duration.ofSeconds(15));
        Duration waited = limiter.acquire();

        assertThat(waited).isEqualTo(Duration.ofSeconds(45));
        assertThat(clock.instant()).isEqualTo(START.plusSeconds(60));
    }

    @Test
    @DisplayName("onServerThrottle: clears the window and holds admission until the cooldown ends")
    void onServerThrottle_clearsWindowAndBlocks() {
        config.setMinIntervalMs(0);
        ClockAdvancingLimiter limiter = new ClockAdvancingLimiter(config, clock);
        for (int i = 0; i < 60; i++) {
            limiter.acquire();
        }

        limiter.onServerThrottle(Duration.ofSeconds(5));

        assertThat(limiter.admittedInWindow()).isZero();
        Duration waited = limiter.acquire();
        assertThat(waited).isEqualTo(Duration.ofSeconds(5));
        assertThat(limiter.admittedInWindow()).isEqualTo(1);
    }

    @Test
    @DisplayName("onServerThrottle: a cooldown that already passed does not delay the next call")
    void onServerThrottle_expiredCooldown_noWait() {
        ClockAdvancingLimiter limiter = new ClockAdvancingLimiter(config, clock);

        limiter.onServerThrottle(Duration.ofSeconds(2));
        clock.advance(Duration.ofSeconds(3));

        assertThat(limiter.acquire()).isZero();
    }

    @Test
    @DisplayName("separate instances keep separate windows")
    void separateInstances_doNotShareState() {
        config.setMinIntervalMs(0);
        config.setRequestsPerMinute(2);
        ClockAdvancingLimiter first = new ClockAdvancingLimiter(config, clock);
        ClockAdvancingLimiter second = new ClockAdvancingLimiter(config, new MutableClock(START));

        first.acquire();
        first.acquire();

        assertThat(second.acquire()).isZero();
        assertThat(second.admittedInWindow()).isEqualTo(1);
        assertThat(first.admittedInWindow()).isEqualTo(2);
    }

    @Test
    @DisplayName("acquire: concurrent callers never overshoot the quota")
    void acquire_concurrentCallers_serialized() throws Exception {
        config.setMinIntervalMs(0);
        config.setRequestsPerMinute(5);
        ClockAdvancingLimiter limiter = new ClockAdvancingLimiter(config, clock);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Duration>> futures = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                futures.add(executor.submit(limiter::acquire));
            }
            for (Future<Duration> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(clock.instant()).isEqualTo(START.plusSeconds(60));
        assertThat(limiter.admittedInWindow()).isEqualTo(5);
    }
}
