package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며 상태를 추적하지 않습니다.
 * Circuit Breaker가 비활성화된 설정에서 사용합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public void recordSuccess() {
        // NoOp
    }

    @Override
    public void recordFailure(Throwable cause) {
        // NoOp
    }

    @Override
    public void releasePermit() {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public void reset() {
        // NoOp
    }
}
