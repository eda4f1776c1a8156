package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.result.ErrorKind;
import com.ryuqq.relay.core.result.OperationResult;

import java.time.Duration;

/**
 * 엔진 경계에서 노출되는 분류된 실패의 최상위 예외.
 *
 * <p>모든 하위 예외는 실패한 {@link OperationResult}를 그대로 보관하므로
 * 시도 횟수와 총 소요 시간을 조회할 수 있습니다.</p>
 *
 * <p><strong>예외 계층:</strong></p>
 * <ul>
 *   <li>{@link AuthenticationException}: 401/403</li>
 *   <li>{@link RateLimitedException}: 429 재시도 소진</li>
 *   <li>{@link CircuitOpenException}: Circuit Breaker 거부 (시도 0회)</li>
 *   <li>{@link RequestTimeoutException}: 시도 타임아웃 소진, 폴링/호출 마감 초과</li>
 *   <li>{@link OperationFailedException}: 재시도 불가 실패</li>
 *   <li>{@link TransientNetworkException}: 네트워크 오류/5xx 재시도 소진</li>
 *   <li>{@link RequestCancelledException}: 호출자 취소</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public abstract class RelayException extends RuntimeException {

    private final transient OperationResult result;

    protected RelayException(OperationResult result) {
        super(describe(result));
        this.result = result;
    }

    /**
     * 실패 결과를 분류에 맞는 예외로 변환.
     *
     * @param result 실패 결과
     * @return errorKind에 대응하는 예외
     * @throws IllegalArgumentException result가 null이거나 성공 결과인 경우
     */
    public static RelayException from(OperationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (result.success()) {
            throw new IllegalArgumentException("cannot raise an exception for a successful result");
        }
        return switch (result.errorKind()) {
            case AUTHENTICATION -> new AuthenticationException(result);
            case RATE_LIMITED -> new RateLimitedException(result);
            case CIRCUIT_OPEN -> new CircuitOpenException(result);
            case TIMEOUT -> new RequestTimeoutException(result);
            case OPERATION -> new OperationFailedException(result);
            case TRANSIENT_NETWORK -> new TransientNetworkException(result);
            case CANCELLED -> new RequestCancelledException(result);
        };
    }

    private static String describe(OperationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return String.format("%s (attempts=%d, elapsed=%dms%s)",
            result.message(),
            result.attempts(),
            result.totalElapsed().toMillis(),
            result.statusCode() == null ? "" : ", status=" + result.statusCode());
    }

    public OperationResult getResult() {
        return result;
    }

    public ErrorKind getErrorKind() {
        return result.errorKind();
    }

    public int getAttempts() {
        return result.attempts();
    }

    public Duration getTotalElapsed() {
        return result.totalElapsed();
    }

    /**
     * 마지막 HTTP 상태 코드.
     *
     * @return 상태 코드 (응답이 없었으면 null)
     */
    public Integer getStatusCode() {
        return result.statusCode();
    }
}
