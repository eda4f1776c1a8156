package com.ryuqq.relay.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 failureThreshold회)
 * OPEN (차단)
 *   │
 *   ▼ (timeout 경과 후 다음 tryAcquire)
 * HALF_OPEN (시험 요청 1건)
 *   │
 *   ├─► 성공 → CLOSED
 *   └─► 실패 → OPEN
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태. 모든 요청 통과, 연속 실패 횟수를 추적합니다.
     */
    CLOSED,

    /**
     * 차단 상태. 네트워크 시도 없이 즉시 거부합니다.
     */
    OPEN,

    /**
     * 반개방 상태. 시험 요청 한 건만 통과시킵니다.
     */
    HALF_OPEN
}
