package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.result.OperationResult;

/**
 * 재시도 불가 실패 (4xx, 잘못된 응답, 비멱등 요청의 서버 오류 등).
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class OperationFailedException extends RelayException {

    public OperationFailedException(OperationResult result) {
        super(result);
    }
}
