package com.ryuqq.relay.core.result;

import com.ryuqq.relay.core.exception.RelayException;
import com.ryuqq.relay.core.model.Payload;

import java.time.Duration;

/**
 * 논리 호출 하나(재시도, 폴링 포함)의 최종 결과.
 *
 * <p>호출당 한 번 생성되며 이후 변경되지 않습니다.
 * 실패 결과도 시도 횟수와 총 소요 시간을 담고 있어서, 호출자는
 * "Circuit OPEN으로 즉시 실패"와 "재시도 소진 후 실패"를 구분할 수 있습니다.</p>
 *
 * @param success 성공 여부
 * @param statusCode 마지막 HTTP 상태 코드 (네트워크 오류/Circuit OPEN이면 null)
 * @param payload 최종 응답 본문 (없으면 빈 Payload)
 * @param errorKind 실패 분류 (성공이면 null)
 * @param message 실패 메시지 (성공이면 null)
 * @param attempts 네트워크 시도 총 횟수 (재시도, 폴링 요청 포함)
 * @param polls 비동기 폴링 요청 횟수
 * @param totalElapsed 총 소요 시간
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record OperationResult(
    boolean success,
    Integer statusCode,
    Payload payload,
    ErrorKind errorKind,
    String message,
    int attempts,
    int polls,
    Duration totalElapsed
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 성공/실패와 errorKind가 맞지 않거나 값이 유효하지 않은 경우
     */
    public OperationResult {
        if (success && errorKind != null) {
            throw new IllegalArgumentException("successful result cannot carry errorKind (current: " + errorKind + ")");
        }
        if (!success && errorKind == null) {
            throw new IllegalArgumentException("failed result must carry errorKind");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        if (polls < 0) {
            throw new IllegalArgumentException("polls must be non-negative (current: " + polls + ")");
        }
        if (totalElapsed == null || totalElapsed.isNegative()) {
            throw new IllegalArgumentException("totalElapsed must be non-negative (current: " + totalElapsed + ")");
        }
        if (payload == null) {
            payload = Payload.empty();
        }
    }

    /**
     * 성공 결과 생성.
     */
    public static OperationResult success(int statusCode, Payload payload, int attempts, int polls, Duration totalElapsed) {
        return new OperationResult(true, statusCode, payload, null, null, attempts, polls, totalElapsed);
    }

    /**
     * 실패 결과 생성.
     */
    public static OperationResult failure(
        ErrorKind errorKind,
        String message,
        Integer statusCode,
        Payload payload,
        int attempts,
        int polls,
        Duration totalElapsed
    ) {
        return new OperationResult(false, statusCode, payload, errorKind, message, attempts, polls, totalElapsed);
    }

    /**
     * 성공이면 자신을 반환하고, 실패면 분류된 예외를 던짐.
     *
     * @return 성공 결과
     * @throws RelayException 실패 결과인 경우 (errorKind에 대응하는 하위 타입)
     */
    public OperationResult orThrow() {
        if (success) {
            return this;
        }
        throw RelayException.from(this);
    }
}
