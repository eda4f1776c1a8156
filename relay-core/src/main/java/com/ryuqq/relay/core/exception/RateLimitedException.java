package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.result.OperationResult;

/**
 * 429 응답이 재시도 소진 후에도 계속된 경우.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RateLimitedException extends RelayException {

    public RateLimitedException(OperationResult result) {
        super(result);
    }
}
