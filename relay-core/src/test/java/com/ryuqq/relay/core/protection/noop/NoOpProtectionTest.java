package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.time.CallContext;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOp 보호 정책 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class NoOpProtectionTest {

    @Test
    void circuitBreaker_AlwaysAllowsAfterFailures() {
        // Given
        NoOpCircuitBreaker breaker = new NoOpCircuitBreaker();

        // When
        for (int i = 0; i < 100; i++) {
            breaker.recordFailure(new RuntimeException("boom"));
        }

        // Then
        assertTrue(breaker.tryAcquire());
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
    }

    @Test
    void rateLimiter_NeverWaits() throws Exception {
        // Given
        NoOpRateLimiter limiter = new NoOpRateLimiter();

        // Then
        for (int i = 0; i < 1000; i++) {
            assertTrue(limiter.tryAcquire());
            assertEquals(Duration.ZERO, limiter.acquire(CallContext.none()));
        }
        assertTrue(limiter.getConfig().isUnlimited());
    }
}
