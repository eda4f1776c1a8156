package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.result.OperationResult;

/**
 * 네트워크 오류 또는 5xx가 재시도 소진까지 반복된 경우.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class TransientNetworkException extends RelayException {

    public TransientNetworkException(OperationResult result) {
        super(result);
    }
}
