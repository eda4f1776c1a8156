package com.ryuqq.relay.core.outcome;

/**
 * 단일 시도(또는 재시도 루프)의 분류된 결과.
 *
 * <p>Outcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 최종 성공 응답 (2xx)</li>
 *   <li>{@link Pending}: 202 Accepted, 후속 위치 폴링 필요</li>
 *   <li>{@link Retry}: 일시적 실패, 재시도 가능</li>
 *   <li>{@link Fail}: 영구적 실패, 재시도 불가</li>
 * </ul>
 *
 * <p>엔진 내부에서는 예외 대신 Outcome으로 흐름을 제어하고,
 * 엔진 경계에서만 {@link com.ryuqq.relay.core.exception.RelayException}으로 변환합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Pending, Retry, Fail {

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isPending() {
        return this instanceof Pending;
    }

    default boolean isRetry() {
        return this instanceof Retry;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }
}
