package com.ryuqq.relay.core.outcome;

import com.ryuqq.relay.core.result.ErrorKind;
import com.ryuqq.relay.core.spi.TransportResponse;

import java.time.Duration;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>네트워크 오류, 연결 실패</li>
 *   <li>시도당 타임아웃, 408 Request Timeout</li>
 *   <li>5xx 서버 오류</li>
 *   <li>429 Too Many Requests</li>
 * </ul>
 *
 * @param kind 재시도가 소진되면 노출될 실패 분류
 * @param reason 재시도 사유
 * @param response 실패 응답 (네트워크 오류면 null)
 * @param retryAfterHint Retry-After 헤더 값 (없으면 null)
 * @param cause 원인 예외 (응답이 있으면 null)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Retry(
    ErrorKind kind,
    String reason,
    TransportResponse response,
    Duration retryAfterHint,
    Throwable cause
) implements Outcome {

    public Retry {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (retryAfterHint != null && retryAfterHint.isNegative()) {
            throw new IllegalArgumentException("retryAfterHint must be non-negative (current: " + retryAfterHint + ")");
        }
    }

    /**
     * 상태 코드 조회.
     *
     * @return 응답 상태 코드 (네트워크 오류면 null)
     */
    public Integer statusCode() {
        return response == null ? null : response.statusCode();
    }
}
