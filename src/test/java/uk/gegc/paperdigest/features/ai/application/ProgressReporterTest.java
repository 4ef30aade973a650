package uk.gegc.paperdigest.features.ai.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.paperdigest.BaseUnitTest;
import uk.gegc.paperdigest.shared.config.AiRateLimitConfig;
import uk.gegc.paperdigest.testsupport.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProgressReporter Tests")
class ProgressReporterTest extends BaseUnitTest {

    private MutableClock clock;
    private ProgressReporter reporter;
    private final List<String> received = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        reporter = new ProgressReporter(new AiRateLimitConfig(), clock);
        reporter.setListener((message, progress) -> received.add(message));
    }

    @Test
    @DisplayName("report: an update inside the throttle interval is superseded by the next one")
    void report_withinInterval_superseded() {
        assertThat(reporter.report("first", 0.1)).isTrue();
        clock.advance(Duration.ofMillis(499));
        assertThat(reporter.report("second", 0.2)).isFalse();
        clock.advance(Duration.ofMillis(1));
        assertThat(reporter.report("third", 0.3)).isTrue();

        assertThat(received).containsExactly("first", "third");
    }

    @Test
    @DisplayName("report: completion is delivered inside the interval after the latest held update")
    void report_completionInsideInterval_flushesPendingThenDelivers() {
        reporter.report("start", 0.1);
        clock.advance(Duration.ofMillis(100));
        reporter.report("middle", 0.5);
        clock.advance(Duration.ofMillis(100));
        reporter.report("almost", 0.9);
        clock.advance(Duration.ofMillis(100));

        assertThat(reporter.report("done", 1.0)).isTrue();

        assertThat(received).containsExactly("start", "almost", "done");
    }

    @Test
    @DisplayName("report: completion with nothing held is delivered once")
    void report_completionWithoutPending_deliveredOnce() {
        reporter.report("start", 0.1);

        assertThat(reporter.report("done", 1.0)).isTrue();
        clock.advance(Duration.ofMillis(100));
        assertThat(reporter.report("after", 0.2)).isFalse();

        assertThat(received).containsExactly("start", "done");
    }

    @Test
    @DisplayName("report: a failing listener does not propagate")
    void report_listenerThrows_swallowed() {
        reporter.setListener((message, progress) -> {
            throw new IllegalStateException("ui closed");
        });

        assertThat(reporter.report("update", 0.5)).isTrue();
    }

    @Test
    @DisplayName("report: progress value is forwarded to the listener")
    void report_forwardsProgress() {
        List<Double> values = new ArrayList<>();
        reporter.setListener((message, progress) -> values.add(progress));

        reporter.report("half way", 0.5);

        assertThat(values).containsExactly(0.5);
    }

    @Test
    @DisplayName("setListener: null restores the logging listener")
    void setListener_null_restoresDefault() {
        reporter.setListener(null);

        assertThat(reporter.report("logged", 1.0)).isTrue();
        assertThat(received).isEmpty();
    }
}
