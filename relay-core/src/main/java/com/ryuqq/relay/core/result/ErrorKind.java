package com.ryuqq.relay.core.result;

/**
 * 실패 분류.
 *
 * <p>{@link OperationResult#errorKind()}와 예외 계층
 * ({@link com.ryuqq.relay.core.exception.RelayException})이 이 분류를 공유합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 401/403. 재시도하지 않고 즉시 반환.
     */
    AUTHENTICATION,

    /**
     * 429가 재시도 소진 후에도 계속된 경우.
     */
    RATE_LIMITED,

    /**
     * Circuit Breaker가 네트워크 시도 없이 거부.
     */
    CIRCUIT_OPEN,

    /**
     * 시도당 타임아웃이 재시도 소진까지 반복되었거나, 비동기 폴링 또는 호출 마감 시간을 초과.
     */
    TIMEOUT,

    /**
     * 재시도 불가 실패 (4xx, 잘못된 응답 등).
     */
    OPERATION,

    /**
     * 네트워크 오류/5xx가 재시도 소진까지 반복됨.
     */
    TRANSIENT_NETWORK,

    /**
     * 호출자가 취소.
     */
    CANCELLED
}
