package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.protection.RateLimiter;
import com.ryuqq.relay.core.protection.RateLimiterConfig;
import com.ryuqq.relay.core.time.CallContext;

import java.time.Duration;

/**
 * Rate Limiter NoOp 구현 (무제한 모드).
 *
 * <p>대기하지 않고 항상 즉시 통과합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimiterConfig UNLIMITED = RateLimiterConfig.unlimited();

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public Duration acquire(CallContext context) {
        return Duration.ZERO;
    }

    @Override
    public RateLimiterConfig getConfig() {
        return UNLIMITED;
    }
}
