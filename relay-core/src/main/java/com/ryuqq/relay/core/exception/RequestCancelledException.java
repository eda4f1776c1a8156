package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.result.OperationResult;

/**
 * 호출자가 {@link com.ryuqq.relay.core.time.CancellationToken}으로 취소한 경우.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RequestCancelledException extends RelayException {

    public RequestCancelledException(OperationResult result) {
        super(result);
    }
}
