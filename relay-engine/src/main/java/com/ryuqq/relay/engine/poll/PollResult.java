package com.ryuqq.relay.engine.poll;

import com.ryuqq.relay.core.outcome.Outcome;

/**
 * 폴링 루프 결과.
 *
 * @param outcome Ok(완료 응답) 또는 Fail
 * @param attempts 폴링 중 발생한 네트워크 시도 수 (폴링 요청의 재시도 포함)
 * @param polls 폴링 요청 수
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record PollResult(Outcome outcome, int attempts, int polls) {

    public PollResult {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (attempts < 0 || polls < 0) {
            throw new IllegalArgumentException("attempts and polls must be non-negative (attempts: " + attempts + ", polls: " + polls + ")");
        }
    }
}
