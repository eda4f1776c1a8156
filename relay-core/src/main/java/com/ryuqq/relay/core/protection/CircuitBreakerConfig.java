package com.ryuqq.relay.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정.
 *
 * @param failureThreshold OPEN 전이까지 허용하는 연속 실패 횟수 (1 이상)
 * @param openTimeout OPEN 유지 시간, 경과 후 HALF_OPEN 시험 허용 (양수)
 * @author Relay Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(int failureThreshold, Duration openTimeout) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 값이 유효하지 않은 경우
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive (current: " + failureThreshold + ")");
        }
        if (openTimeout == null || openTimeout.isNegative() || openTimeout.isZero()) {
            throw new IllegalArgumentException("openTimeout must be positive (current: " + openTimeout + ")");
        }
    }

    /**
     * 기본값: failureThreshold=5, openTimeout=60s.
     */
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(5, Duration.ofSeconds(60));
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, openTimeout);
    }

    public CircuitBreakerConfig withOpenTimeout(Duration openTimeout) {
        return new CircuitBreakerConfig(failureThreshold, openTimeout);
    }
}
