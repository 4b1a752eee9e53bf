package ch.so.arp.rag.hybrid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class SlidingWindowAdmissionControlTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
    private final SlidingWindowAdmissionControl admissionControl = new SlidingWindowAdmissionControl(clock);

    @Test
    void rejectsRequestsBeyondTheLimit() {
        admissionControl.check("query", "tenant-a", 2, Duration.ofHours(1));
        admissionControl.check("query", "tenant-a", 2, Duration.ofHours(1));

        assertThatThrownBy(() -> admissionControl.check("query", "tenant-a", 2, Duration.ofHours(1)))
                .isInstanceOf(RateLimitedException.class)
                .hasMessage("Rate limit exceeded for query. Try again later.");
    }

    @Test
    void keysAndScopesHaveSeparateBudgets() {
        admissionControl.check("ingest", "tenant-a", 1, Duration.ofHours(1));

        assertThatCode(() -> admissionControl.check("ingest", "tenant-b", 1, Duration.ofHours(1)))
                .doesNotThrowAnyException();
        assertThatCode(() -> admissionControl.check("query", "tenant-a", 1, Duration.ofHours(1)))
                .doesNotThrowAnyException();
    }

    @Test
    void admitsAgainOnceTheWindowHasPassed() {
        admissionControl.check("ingest", "tenant-a", 1, Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(61));

        assertThatCode(() -> admissionControl.check("ingest", "tenant-a", 1, Duration.ofHours(1)))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectionOfAnEmptyWindowLeavesNoKeyBehind() {
        assertThatThrownBy(() -> admissionControl.check("query", "tenant-a", 0, Duration.ofHours(1)))
                .isInstanceOf(RateLimitedException.class);

        assertThat(admissionControl.trackedKeys()).isZero();
    }

    @Test
    void forgetsKeysWhoseWindowHasPassed() {
        admissionControl.check("query", "tenant-a", 5, Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(61));

        for (int i = 0; i < SlidingWindowAdmissionControl.SWEEP_INTERVAL - 1; i++) {
            admissionControl.check("query", "client-" + i, 5, Duration.ofHours(1));
        }

        assertThat(admissionControl.trackedKeys()).isEqualTo(SlidingWindowAdmissionControl.SWEEP_INTERVAL - 1);
        assertThatCode(() -> admissionControl.check("query", "tenant-a", 1, Duration.ofHours(1)))
                .doesNotThrowAnyException();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
