package com.ryuqq.relay.engine.poll;

import java.net.URI;
import java.time.Duration;

/**
 * 진행 중인 서버 비동기 작업 (202 Accepted 이후).
 *
 * <p>폴링 루프 하나 동안만 존재합니다.</p>
 *
 * @param location 상태 조회 URI
 * @param startedAtNanos 첫 202를 받은 시각 (Ticker 기준)
 * @param retryAfterHint 서버가 마지막으로 제시한 대기 시간 (없으면 null)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record PendingOperation(URI location, long startedAtNanos, Duration retryAfterHint) {

    public PendingOperation {
        if (location == null) {
            throw new IllegalArgumentException("location cannot be null");
        }
    }

    /**
     * 다음 202 응답으로 갱신.
     *
     * <p>새 응답에 Location/Retry-After가 없으면 이전 값을 유지합니다.</p>
     */
    public PendingOperation withUpdate(URI newLocation, Duration newHint) {
        return new PendingOperation(
            newLocation != null ? newLocation : location,
            startedAtNanos,
            newHint != null ? newHint : retryAfterHint
        );
    }
}
