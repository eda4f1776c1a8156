package com.ryuqq.relay.engine.retry;

import com.ryuqq.relay.core.model.RequestSpec;
import com.ryuqq.relay.core.outcome.Fail;
import com.ryuqq.relay.core.outcome.Ok;
import com.ryuqq.relay.core.outcome.Outcome;
import com.ryuqq.relay.core.outcome.Pending;
import com.ryuqq.relay.core.outcome.Retry;
import com.ryuqq.relay.core.result.ErrorKind;
import com.ryuqq.relay.core.spi.TransportResponse;
import com.ryuqq.relay.core.spi.TransportTimeoutException;
import com.ryuqq.relay.engine.backoff.RetryAfter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;

/**
 * HTTP 응답/전송 오류를 {@link Outcome}으로 분류.
 *
 * <table>
 *   <caption>분류 규칙</caption>
 *   <tr><th>입력</th><th>결과</th></tr>
 *   <tr><td>202 + Location</td><td>Pending (Location은 요청 URL 기준으로 해석)</td></tr>
 *   <tr><td>202 (Location 없음), 그 외 2xx</td><td>Ok</td></tr>
 *   <tr><td>429</td><td>Retry(RATE_LIMITED, Retry-After 힌트)</td></tr>
 *   <tr><td>408</td><td>Retry(TIMEOUT)</td></tr>
 *   <tr><td>5xx</td><td>Retry(TRANSIENT_NETWORK, Retry-After 힌트)</td></tr>
 *   <tr><td>401, 403</td><td>Fail(AUTHENTICATION)</td></tr>
 *   <tr><td>그 외 (3xx, 4xx)</td><td>Fail(OPERATION)</td></tr>
 *   <tr><td>시도 타임아웃</td><td>Retry(TIMEOUT)</td></tr>
 *   <tr><td>그 외 I/O 오류</td><td>Retry(TRANSIENT_NETWORK)</td></tr>
 * </table>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ResponseClassifier {

    private static final Logger log = LoggerFactory.getLogger(ResponseClassifier.class);

    private final Clock clock;

    public ResponseClassifier() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock Retry-After HTTP-date 해석 기준 시계
     */
    public ResponseClassifier(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * 응답 분류.
     *
     * @param request 보낸 요청 (상대 Location 해석용)
     * @param response 받은 응답
     * @return Ok, Pending, Retry, Fail 중 하나
     */
    public Outcome classify(RequestSpec request, TransportResponse response) {
        int status = response.statusCode();

        if (status == 202) {
            return classifyAccepted(request, response);
        }
        if (response.isSuccessful()) {
            return new Ok(response);
        }
        if (status == 429) {
            return new Retry(ErrorKind.RATE_LIMITED, "rate limited (429)", response, retryAfter(response), null);
        }
        if (status == 408) {
            return new Retry(ErrorKind.TIMEOUT, "request timeout (408)", response, null, null);
        }
        if (status >= 500) {
            return new Retry(ErrorKind.TRANSIENT_NETWORK, "server error (" + status + ")", response, retryAfter(response), null);
        }
        if (status == 401 || status == 403) {
            return new Fail(ErrorKind.AUTHENTICATION, "authentication failed (" + status + ")", response, null, false);
        }
        return new Fail(ErrorKind.OPERATION, "request failed (" + status + ")", response, null, false);
    }

    /**
     * 전송 오류 분류.
     *
     * @param error 네트워크 오류
     * @return Retry(TIMEOUT) 또는 Retry(TRANSIENT_NETWORK)
     */
    public Retry networkFailure(IOException error) {
        if (error instanceof TransportTimeoutException) {
            return new Retry(ErrorKind.TIMEOUT, "attempt timed out: " + error.getMessage(), null, null, error);
        }
        return new Retry(ErrorKind.TRANSIENT_NETWORK,
            "network error: " + error.getClass().getSimpleName() + ": " + error.getMessage(), null, null, error);
    }

    private Outcome classifyAccepted(RequestSpec request, TransportResponse response) {
        String location = response.header("Location").orElse(null);
        if (location == null || location.isBlank()) {
            log.warn("[{}] 202 Accepted without Location header, treating as completed", request.url().getHost());
            return new Ok(response);
        }
        URI resolved;
        try {
            resolved = request.url().resolve(location.trim());
        } catch (IllegalArgumentException e) {
            return new Fail(ErrorKind.OPERATION, "invalid Location header: " + location, response, e, false);
        }
        if (!resolved.isAbsolute() || resolved.getHost() == null) {
            return new Fail(ErrorKind.OPERATION, "invalid Location header: " + location, response, null, false);
        }
        return new Pending(resolved, retryAfter(response), response);
    }

    /**
     * Retry-After 헤더 해석.
     *
     * @param response 응답
     * @return 대기 시간 (헤더가 없거나 해석 불가하면 null)
     */
    public Duration retryAfter(TransportResponse response) {
        return response.header("Retry-After")
            .flatMap(value -> RetryAfter.parse(value, clock))
            .orElse(null);
    }
}
