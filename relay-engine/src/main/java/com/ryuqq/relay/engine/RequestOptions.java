package com.ryuqq.relay.engine;

import com.ryuqq.relay.core.time.CallContext;
import com.ryuqq.relay.core.time.CancellationToken;
import com.ryuqq.relay.core.time.Deadline;
import com.ryuqq.relay.core.time.Ticker;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 호출 단위 옵션.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RequestOptions options = RequestOptions.defaults()
 *     .withIfMatch("W/\"42\"")
 *     .withTimeout(Duration.ofSeconds(30))
 *     .withCancellation(token);
 *
 * engine.patch(url, Payload.of(json), options);
 * }</pre>
 *
 * @param headers 기본 헤더를 덮어쓰거나 추가할 헤더
 * @param ifMatch If-Match 헤더로 보낼 ETag (없으면 null)
 * @param idempotent 메서드 기본 멱등성 대신 사용할 값 (없으면 null)
 * @param timeout 논리 호출 전체 마감 시간 (없으면 null, 무제한)
 * @param cancellation 호출자 취소 신호
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record RequestOptions(
    Map<String, String> headers,
    String ifMatch,
    Boolean idempotent,
    Duration timeout,
    CancellationToken cancellation
) {

    private static final RequestOptions DEFAULTS = new RequestOptions(Map.of(), null, null, null, CancellationToken.none());

    public RequestOptions {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        if (ifMatch != null && ifMatch.isBlank()) {
            throw new IllegalArgumentException("ifMatch cannot be blank");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (cancellation == null) {
            cancellation = CancellationToken.none();
        }
    }

    public static RequestOptions defaults() {
        return DEFAULTS;
    }

    public RequestOptions withHeader(String name, String value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("header name cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("header value cannot be null");
        }
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.put(name, value);
        return new RequestOptions(merged, ifMatch, idempotent, timeout, cancellation);
    }

    public RequestOptions withIfMatch(String ifMatch) {
        return new RequestOptions(headers, ifMatch, idempotent, timeout, cancellation);
    }

    public RequestOptions withIdempotent(boolean idempotent) {
        return new RequestOptions(headers, ifMatch, idempotent, timeout, cancellation);
    }

    public RequestOptions withTimeout(Duration timeout) {
        return new RequestOptions(headers, ifMatch, idempotent, timeout, cancellation);
    }

    public RequestOptions withCancellation(CancellationToken cancellation) {
        return new RequestOptions(headers, ifMatch, idempotent, timeout, cancellation);
    }

    /**
     * 호출 컨텍스트 생성 (마감 시각은 지금부터 계산).
     *
     * @param ticker 단조 시계
     * @return CallContext
     */
    public CallContext toContext(Ticker ticker) {
        Deadline deadline = timeout == null ? Deadline.none() : Deadline.after(timeout, ticker);
        return new CallContext(deadline, cancellation);
    }
}
