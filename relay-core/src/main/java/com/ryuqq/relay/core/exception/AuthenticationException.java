package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.result.OperationResult;

/**
 * 인증/인가 실패 (401, 403). 재시도 없이 즉시 노출됩니다.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class AuthenticationException extends RelayException {

    public AuthenticationException(OperationResult result) {
        super(result);
    }
}
