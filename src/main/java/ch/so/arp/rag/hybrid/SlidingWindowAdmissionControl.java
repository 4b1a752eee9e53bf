package ch.so.arp.rag.hybrid;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory sliding window {@link AdmissionControl}. State is per process.
 * Keys whose window has emptied are dropped, on their next check or by a sweep
 * every {@value #SWEEP_INTERVAL} checks.
 */
class SlidingWindowAdmissionControl implements AdmissionControl {

    private static final Logger LOGGER = LoggerFactory.getLogger(SlidingWindowAdmissionControl.class);

    static final int SWEEP_INTERVAL = 256;

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final AtomicInteger checks = new AtomicInteger();
    private final Clock clock;

    SlidingWindowAdmissionControl(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void check(String scope, String key, int limit, Duration window) {
        Instant now = clock.instant();
        int[] rejectedAt = { -1 };
        // compute runs atomically per key, so a bucket is never dropped while in use
        buckets.compute(scope + ":" + key, (ignored, existing) -> {
            Bucket bucket = existing == null ? new Bucket() : existing;
            bucket.window = window;
            bucket.prune(now);
            if (bucket.events.size() >= limit) {
                rejectedAt[0] = bucket.events.size();
                return bucket.events.isEmpty() ? null : bucket;
            }
            bucket.events.addLast(now);
            return bucket;
        });
        if (checks.incrementAndGet() % SWEEP_INTERVAL == 0) {
            sweep(now);
        }
        if (rejectedAt[0] >= 0) {
            LOGGER.info("Rejected {} request for key {} ({} within {})", scope, key, rejectedAt[0], window);
            throw new RateLimitedException(scope);
        }
    }

    int trackedKeys() {
        return buckets.size();
    }

    private void sweep(Instant now) {
        for (String key : buckets.keySet()) {
            buckets.computeIfPresent(key, (ignored, bucket) -> {
                bucket.prune(now);
                return bucket.events.isEmpty() ? null : bucket;
            });
        }
    }

    private static final class Bucket {

        private final Deque<Instant> events = new ArrayDeque<>();
        private Duration window;

        void prune(Instant now) {
            Instant cutoff = now.minus(window);
            while (!events.isEmpty() && events.peekFirst().isBefore(cutoff)) {
                events.pollFirst();
            }
        }
    }
}
