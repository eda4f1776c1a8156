package com.ryuqq.relay.adapter.protection;

import com.ryuqq.relay.core.protection.RateLimiter;
import com.ryuqq.relay.core.protection.RateLimiterConfig;
import com.ryuqq.relay.core.time.CallAbortedException;
import com.ryuqq.relay.core.time.CallContext;
import com.ryuqq.relay.core.time.Sleeper;
import com.ryuqq.relay.core.time.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token Bucket 기반 Rate Limiter.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * tokens = min(burstSize, tokens + elapsedSeconds * callsPerSecond)
 * tokens >= 1 → 1 소비 후 통과
 * tokens &lt; 1 → (1 - tokens) / callsPerSecond 초 대기 후 재확인
 * </pre>
 *
 * <p>임의의 길이 W 구간에서 허용되는 요청 수는 {@code burstSize + callsPerSecond * W}를 넘지 않습니다.
 * 버킷은 가득 찬 상태로 시작합니다.</p>
 *
 * <p><strong>동시성:</strong> 토큰 장부 갱신만 락 안에서 수행하고,
 * 대기는 락 밖에서 합니다. 여러 스레드가 동시에 대기할 수 있으며
 * 깨어난 뒤 다시 경쟁합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class TokenBucketRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final RateLimiterConfig config;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastRefillNanos;

    /**
     * 시스템 시계로 생성.
     *
     * @param config Rate Limiter 설정
     */
    public TokenBucketRateLimiter(RateLimiterConfig config) {
        this(config, Ticker.system(), Sleeper.system());
    }

    /**
     * 시간원 주입 생성자 (테스트용).
     *
     * @param config Rate Limiter 설정
     * @param ticker 단조 시계
     * @param sleeper 대기 구현
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TokenBucketRateLimiter(RateLimiterConfig config, Ticker ticker, Sleeper sleeper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.tokens = config.burstSize();
        this.lastRefillNanos = ticker.read();
    }

    @Override
    public boolean tryAcquire() {
        if (config.isUnlimited()) {
            return true;
        }
        lock.lock();
        try {
            refill();
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Duration acquire(CallContext context) throws InterruptedException {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (config.isUnlimited()) {
            context.checkpoint();
            return Duration.ZERO;
        }

        long startNanos = ticker.read();
        while (true) {
            context.checkpoint();

            long waitNanos;
            lock.lock();
            try {
                refill();
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    return Duration.ofNanos(Math.max(0L, ticker.read() - startNanos));
                }
                waitNanos = (long) Math.ceil((1.0 - tokens) / config.callsPerSecond() * NANOS_PER_SECOND);
            } finally {
                lock.unlock();
            }

            Duration wait = Duration.ofNanos(Math.max(1L, waitNanos));
            if (context.deadline().isBounded() && context.deadline().remaining().compareTo(wait) < 0) {
                log.debug("Rate limiter wait {}ms exceeds remaining deadline", wait.toMillis());
                throw CallAbortedException.deadlineExceeded();
            }
            log.debug("Rate limiter throttling for {}ms", wait.toMillis());
            sleeper.sleep(wait, context);
        }
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    /**
     * 현재 남은 토큰 수 (모니터링/테스트용).
     *
     * @return 토큰 수
     */
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    // lock 보유 상태에서만 호출
    private void refill() {
        long now = ticker.read();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(config.burstSize(), tokens + elapsed / NANOS_PER_SECOND * config.callsPerSecond());
            lastRefillNanos = now;
        }
    }
}
