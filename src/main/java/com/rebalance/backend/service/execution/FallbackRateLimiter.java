package com.rebalance.backend.service.execution;

import com.rebalance.backend.config.ExecutionProperties;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Spaces out fallback launch attempts per run: one attempt per interval, measured on the application clock.
 * Buckets live until the run turns terminal and is released.
 */
@Component
public class FallbackRateLimiter {

    private final Map<Long, Bucket> buckets = new ConcurrentHashMap<>();
    private final TimeMeter timeMeter;
    private final Duration minInterval;

    public FallbackRateLimiter(Clock clock, ExecutionProperties executionProperties) {
        this.timeMeter = new ClockTimeMeter(clock);
        this.minInterval = Duration.ofSeconds(Math.max(1, executionProperties.getFallbackMinIntervalSeconds()));
    }

    /**
     * @return true and records the attempt when the run has not tried within the minimum interval
     */
    public boolean tryAcquire(Long runId) {
        return buckets.computeIfAbsent(runId, ignored -> newBucket()).tryConsume(1);
    }

    public void release(Long runId) {
        buckets.remove(runId);
    }

    public boolean tracks(Long runId) {
        return buckets.containsKey(runId);
    }

    int trackedRuns() {
        return buckets.size();
    }

    private Bucket newBucket() {
        return Bucket.builder()
                .addLimit(Bandwidth.classic(1, Refill.intervally(1, minInterval)))
                .withCustomTimePrecision(timeMeter)
                .build();
    }

    private static final class ClockTimeMeter implements TimeMeter {

        private final Clock clock;

        private ClockTimeMeter(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long currentTimeNanos() {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}
