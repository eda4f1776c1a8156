package com.ryuqq.relay.adapter.inmemory.time;

import com.ryuqq.relay.core.time.CallAbortedException;
import com.ryuqq.relay.core.time.CallContext;
import com.ryuqq.relay.core.time.Sleeper;
import com.ryuqq.relay.core.time.Ticker;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Manually driven clock implementing both {@link Ticker} and {@link Sleeper}.
 *
 * <p>{@link #sleep(Duration, CallContext)} never blocks: it records the requested duration
 * and advances the clock by that amount. This makes backoff, rate limiting and polling
 * deterministic in tests while the production code still observes time passing.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ManualTicker clock = new ManualTicker();
 * RateLimiter limiter = new TokenBucketRateLimiter(config, clock, clock);
 *
 * limiter.acquire(CallContext.none());
 * assertThat(clock.sleeps()).isEmpty();
 *
 * clock.advance(Duration.ofSeconds(1));
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ManualTicker implements Ticker, Sleeper {

    private final AtomicLong nanos;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    public ManualTicker() {
        this(0L);
    }

    public ManualTicker(long startNanos) {
        this.nanos = new AtomicLong(startNanos);
    }

    @Override
    public long read() {
        return nanos.get();
    }

    /**
     * Records the sleep and advances the clock without blocking.
     *
     * @throws CallAbortedException if the context is already cancelled
     */
    @Override
    public void sleep(Duration duration, CallContext context) {
        if (context.cancellation().isCancelled()) {
            throw CallAbortedException.cancelled();
        }
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return;
        }
        sleeps.add(duration);
        nanos.addAndGet(duration.toNanos());
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount of time to advance (must be non-negative)
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative (current: " + duration + ")");
        }
        nanos.addAndGet(duration.toNanos());
    }

    /**
     * @return every sleep requested so far, in call order
     */
    public List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    /**
     * @return sum of all recorded sleeps
     */
    public Duration totalSlept() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }

    /**
     * @return elapsed time since the given reading of this clock
     */
    public Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(nanos.get() - startNanos);
    }
}
