package com.ryuqq.relay.engine.retry;

import com.ryuqq.relay.core.outcome.Outcome;
import com.ryuqq.relay.core.outcome.Retry;

/**
 * 재시도 루프 결과.
 *
 * @param outcome 최종 결과 (Ok, Pending, Fail 중 하나, Retry는 올 수 없음)
 * @param attempts 실제 네트워크 시도 횟수
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record RetryResult(Outcome outcome, int attempts) {

    public RetryResult {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (outcome instanceof Retry) {
            throw new IllegalArgumentException("retry loop must not end with a Retry outcome");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
    }
}
