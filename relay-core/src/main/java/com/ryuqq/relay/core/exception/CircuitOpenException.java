package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.result.OperationResult;

/**
 * Circuit Breaker가 OPEN 상태여서 네트워크 시도 없이 거부된 경우. {@link #getAttempts()}는 항상 0입니다.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class CircuitOpenException extends RelayException {

    public CircuitOpenException(OperationResult result) {
        super(result);
    }
}
