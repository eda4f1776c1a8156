package com.ryuqq.relay.adapter.protection;

import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.time.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 실패 횟수 기반 Circuit Breaker.
 *
 * <p>CLOSED에서 연속 실패가 {@code failureThreshold}에 도달하면 OPEN으로 전이하고,
 * {@code openTimeout}이 지난 뒤 첫 {@link #tryAcquire()}가 HALF_OPEN 시험 요청이 됩니다.
 * 시험 요청은 동시에 하나만 허용됩니다.</p>
 *
 * <p>OPEN 상태에서 들어온 성공/실패 기록은 무시합니다.
 * (OPEN 전이 전에 출발한 요청의 늦은 결과)</p>
 *
 * <p>HALF_OPEN 상태에서는 시험 허가를 받은 스레드의 기록만 반영합니다.
 * CLOSED 시절에 출발한 요청이 늦게 기록하더라도 시험 결과를 대신하지 않습니다.
 * 허가를 받은 스레드에서 기록/반환해야 합니다 (RequestEngine은 호출 스레드에서 동기 실행).</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    private final CircuitBreakerConfig config;
    private final Ticker ticker;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private long openedAtNanos;
    private Thread trialOwner;

    public ConsecutiveFailureCircuitBreaker(CircuitBreakerConfig config) {
        this(config, Ticker.system());
    }

    /**
     * 시간원 주입 생성자.
     *
     * @param config Circuit Breaker 설정
     * @param ticker 단조 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ConsecutiveFailureCircuitBreaker(CircuitBreakerConfig config, Ticker ticker) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        this.config = config;
        this.ticker = ticker;
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return true;
                case OPEN:
                    long openFor = ticker.read() - openedAtNanos;
                    if (openFor < config.openTimeout().toNanos()) {
                        return false;
                    }
                    state = CircuitBreakerState.HALF_OPEN;
                    trialOwner = Thread.currentThread();
                    log.info("Circuit breaker HALF_OPEN after {}ms, allowing trial request",
                        Duration.ofNanos(openFor).toMillis());
                    return true;
                case HALF_OPEN:
                    if (trialOwner != null) {
                        return false;
                    }
                    trialOwner = Thread.currentThread();
                    return true;
                default:
                    throw new IllegalStateException("Unknown state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess() {
        lock.lock();
        try {
            if (state == CircuitBreakerState.HALF_OPEN) {
                if (!isTrialOwner()) {
                    return;
                }
                state = CircuitBreakerState.CLOSED;
                consecutiveFailures = 0;
                trialOwner = null;
                log.info("Circuit breaker CLOSED after successful trial request");
            } else if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures = 0;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(Throwable cause) {
        lock.lock();
        try {
            if (state == CircuitBreakerState.HALF_OPEN) {
                if (!isTrialOwner()) {
                    return;
                }
                open();
                log.warn("Circuit breaker re-OPENED: trial request failed ({})", describe(cause));
            } else if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures++;
                if (consecutiveFailures >= config.failureThreshold()) {
                    open();
                    log.warn("Circuit breaker OPENED after {} consecutive failures ({})",
                        config.failureThreshold(), describe(cause));
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void releasePermit() {
        lock.lock();
        try {
            if (state == CircuitBreakerState.HALF_OPEN && isTrialOwner()) {
                trialOwner = null;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            state = CircuitBreakerState.CLOSED;
            consecutiveFailures = 0;
            trialOwner = null;
            log.info("Circuit breaker reset to CLOSED");
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 연속 실패 횟수.
     *
     * @return CLOSED 상태에서 누적된 연속 실패 수
     */
    public int getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private void open() {
        state = CircuitBreakerState.OPEN;
        openedAtNanos = ticker.read();
        trialOwner = null;
        consecutiveFailures = 0;
    }

    // HALF_OPEN 시험 허가를 받은 스레드인지
    private boolean isTrialOwner() {
        return trialOwner == Thread.currentThread();
    }

    private static String describe(Throwable cause) {
        return cause == null ? "no cause" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
