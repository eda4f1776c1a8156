package com.ryuqq.relay.core.outcome;

import com.ryuqq.relay.core.result.ErrorKind;
import com.ryuqq.relay.core.spi.TransportResponse;

/**
 * 영구적 실패 (재시도 불가 또는 재시도 소진).
 *
 * <p>{@code dependencyFailure}는 실패가 원격 서비스의 건강 상태를 반영하는지를 나타내며,
 * true인 경우에만 Circuit Breaker의 실패 카운터를 증가시킵니다.</p>
 *
 * <ul>
 *   <li>true: 5xx, 429, 네트워크 오류, 시도당 타임아웃의 재시도 소진</li>
 *   <li>false: 401/403, 기타 4xx, 호출자 취소, 호출 마감 초과</li>
 * </ul>
 *
 * @param kind 실패 분류
 * @param reason 실패 메시지
 * @param response 마지막 응답 (없으면 null)
 * @param cause 원인 예외 (없으면 null)
 * @param dependencyFailure 원격 서비스 장애로 볼지 여부
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Fail(
    ErrorKind kind,
    String reason,
    TransportResponse response,
    Throwable cause,
    boolean dependencyFailure
) implements Outcome {

    public Fail {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    /**
     * 원격 서비스의 판정 없이 끝난 실패 (취소, 호출 마감).
     *
     * @param kind CANCELLED 또는 TIMEOUT
     * @param reason 메시지
     * @param cause 원인
     * @return Fail 인스턴스
     */
    public static Fail aborted(ErrorKind kind, String reason, Throwable cause) {
        return new Fail(kind, reason, null, cause, false);
    }

    /**
     * 재시도 소진 시 마지막 Retry를 영구 실패로 전환.
     *
     * @param last 마지막 Retry
     * @param reason 메시지
     * @return Fail 인스턴스
     */
    public static Fail exhausted(Retry last, String reason) {
        return new Fail(last.kind(), reason, last.response(), last.cause(), true);
    }

    public Integer statusCode() {
        return response == null ? null : response.statusCode();
    }
}
