package com.ryuqq.relay.engine.odata;

import com.ryuqq.relay.core.model.Payload;
import com.ryuqq.relay.core.result.ErrorKind;

/**
 * upsert 결과.
 *
 * @param operation 생성/갱신/실패
 * @param keyValue 조회에 사용한 키 값
 * @param statusCode 마지막 응답 상태 코드 (응답이 없었으면 null)
 * @param payload 마지막 응답 본문
 * @param errorKind 실패 분류 (성공이면 null)
 * @param message 실패 사유 (성공이면 null)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record UpsertResult(
    UpsertOperation operation,
    String keyValue,
    Integer statusCode,
    Payload payload,
    ErrorKind errorKind,
    String message
) {

    public UpsertResult {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (keyValue == null) {
            throw new IllegalArgumentException("keyValue cannot be null");
        }
        if (payload == null) {
            payload = Payload.empty();
        }
        if (operation == UpsertOperation.FAILED && errorKind == null) {
            throw new IllegalArgumentException("errorKind cannot be null for a failed upsert");
        }
    }

    public static UpsertResult created(String keyValue, int statusCode, Payload payload) {
        return new UpsertResult(UpsertOperation.CREATED, keyValue, statusCode, payload, null, null);
    }

    public static UpsertResult updated(String keyValue, int statusCode, Payload payload) {
        return new UpsertResult(UpsertOperation.UPDATED, keyValue, statusCode, payload, null, null);
    }

    public static UpsertResult failed(String keyValue, Integer statusCode, ErrorKind errorKind, String message) {
        return new UpsertResult(UpsertOperation.FAILED, keyValue, statusCode, Payload.empty(), errorKind, message);
    }

    public boolean success() {
        return operation != UpsertOperation.FAILED;
    }
}
