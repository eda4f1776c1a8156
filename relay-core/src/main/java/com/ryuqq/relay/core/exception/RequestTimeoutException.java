package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.result.OperationResult;

/**
 * 시도당 타임아웃이 재시도 소진까지 반복되었거나, 비동기 폴링 최대 대기 시간 또는 호출 마감 시간을 넘긴 경우.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RequestTimeoutException extends RelayException {

    public RequestTimeoutException(OperationResult result) {
        super(result);
    }
}
