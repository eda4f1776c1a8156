package com.ryuqq.relay.engine.backoff;

import java.time.Duration;

/**
 * 백오프 루프의 한도.
 *
 * <p>재시도는 시도 횟수로, 폴링은 경과 시간으로 제한합니다.</p>
 *
 * @param maxAttempts 최대 반복 횟수 (0이면 횟수 제한 없음)
 * @param maxElapsed 최대 경과 시간 (null이면 시간 제한 없음)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record BackoffBudget(int maxAttempts, Duration maxElapsed) {

    public BackoffBudget {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be non-negative (current: " + maxAttempts + ")");
        }
        if (maxElapsed != null && (maxElapsed.isNegative() || maxElapsed.isZero())) {
            throw new IllegalArgumentException("maxElapsed must be positive (current: " + maxElapsed + ")");
        }
        if (maxAttempts == 0 && maxElapsed == null) {
            throw new IllegalArgumentException("budget must be bounded by attempts or elapsed time");
        }
    }

    public static BackoffBudget attempts(int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        return new BackoffBudget(maxAttempts, null);
    }

    public static BackoffBudget wallClock(Duration maxElapsed) {
        return new BackoffBudget(0, maxElapsed);
    }

    boolean allows(int iterations, Duration elapsed) {
        if (maxAttempts > 0 && iterations >= maxAttempts) {
            return false;
        }
        return maxElapsed == null || elapsed.compareTo(maxElapsed) < 0;
    }
}
