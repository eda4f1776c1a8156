package com.ryuqq.relay.core.protection;

/**
 * Circuit Breaker SPI.
 *
 * <p>원격 서비스의 연속 실패를 추적하고, 임계값에 도달하면 빠르게 실패(Fail-Fast)하여
 * 장애가 호출자 전체로 전파되는 것을 막습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * if (!breaker.tryAcquire()) {
 *     return OperationResult.failure(ErrorKind.CIRCUIT_OPEN, ...);
 * }
 * Outcome outcome = retryExecutor.execute(request, context).outcome();
 * if (outcome.isOk()) {
 *     breaker.recordSuccess();
 * } else {
 *     breaker.recordFailure(cause);
 * }
 * }</pre>
 *
 * <p>구현체는 모든 상태 전이를 하나의 락 안에서 수행해야 하며,
 * 네트워크 I/O 동안 락을 잡고 있어서는 안 됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 요청 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: timeout 경과 전이면 false, 경과했으면 HALF_OPEN으로 전이 후 true (시험 요청)</li>
     *   <li>HALF_OPEN: 진행 중인 시험 요청이 있으면 false</li>
     * </ul>
     *
     * @return true: 통과, false: 차단
     */
    boolean tryAcquire();

    /**
     * 논리 호출 성공 기록.
     *
     * <p>CLOSED: 연속 실패 횟수 초기화. HALF_OPEN: CLOSED로 전이.</p>
     */
    void recordSuccess();

    /**
     * 논리 호출 실패 기록 (호출당 최대 한 번).
     *
     * <p>CLOSED: 연속 실패 증가, 임계값 도달 시 OPEN. HALF_OPEN: 즉시 OPEN.</p>
     *
     * @param cause 실패 원인 (없으면 null)
     */
    void recordFailure(Throwable cause);

    /**
     * 판정 없이 끝난 호출의 허가 반환.
     *
     * <p>취소/마감 등으로 성공도 실패도 기록하지 않는 경우 호출합니다.
     * HALF_OPEN 시험 슬롯을 다음 호출이 사용할 수 있도록 풀어줍니다.</p>
     */
    void releasePermit();

    /**
     * 현재 상태 조회 (상태 전이 없음).
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * CLOSED 상태로 강제 리셋.
     */
    void reset();
}
