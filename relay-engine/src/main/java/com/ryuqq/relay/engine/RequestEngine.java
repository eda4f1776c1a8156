package com.ryuqq.relay.engine;

import com.ryuqq.relay.core.model.HttpMethod;
import com.ryuqq.relay.core.model.Payload;
import com.ryuqq.relay.core.model.RequestSpec;
import com.ryuqq.relay.core.outcome.Fail;
import com.ryuqq.relay.core.outcome.Ok;
import com.ryuqq.relay.core.outcome.Outcome;
import com.ryuqq.relay.core.outcome.Pending;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.RateLimiter;
import com.ryuqq.relay.core.result.ErrorKind;
import com.ryuqq.relay.core.result.OperationResult;
import com.ryuqq.relay.core.spi.TransportFactory;
import com.ryuqq.relay.core.spi.TransportResponse;
import com.ryuqq.relay.core.time.CallAbortedException;
import com.ryuqq.relay.core.time.CallContext;
import com.ryuqq.relay.core.time.Sleeper;
import com.ryuqq.relay.core.time.Ticker;
import com.ryuqq.relay.engine.config.EngineConfig;
import com.ryuqq.relay.engine.poll.AsyncOperationPoller;
import com.ryuqq.relay.engine.poll.PollResult;
import com.ryuqq.relay.engine.retry.ResponseClassifier;
import com.ryuqq.relay.engine.retry.RetryExecutor;
import com.ryuqq.relay.engine.retry.RetryResult;
import com.ryuqq.relay.engine.session.SessionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.random.RandomGenerator;

/**
 * HTTP 요청 엔진 (공개 진입점).
 *
 * <p>요청 하나를 Rate Limit, Circuit Breaker, 재시도, 202 폴링을 거치는
 * 하나의 논리 호출로 실행하고, 결과를 {@link OperationResult}로 반환합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 헤더 구성 (기본 헤더 → Authorization → 호출 헤더 → If-Match, 이름 대소문자 무시)
 * 2. CircuitBreaker.tryAcquire() 실패 → CIRCUIT_OPEN (시도 0회)
 * 3. RateLimiter.acquire()
 * 4. RetryExecutor.execute()
 * 5. Pending → AsyncOperationPoller.poll()
 * 6. Circuit Breaker에 결과 기록 (호출당 정확히 한 번)
 * 7. OperationResult 생성
 * </pre>
 *
 * <p><strong>Circuit Breaker 기록 규칙:</strong></p>
 * <ul>
 *   <li>Ok → recordSuccess</li>
 *   <li>원격 장애로 인한 Fail (5xx/429/네트워크 오류 소진, 비멱등 요청의 서버 오류) → recordFailure</li>
 *   <li>서버가 판정한 Fail (401/403/4xx, 폴링 시간 초과) → recordSuccess (서버는 정상 응답)</li>
 *   <li>취소, 호출 마감 초과 → releasePermit (판정 없음)</li>
 *   <li>Transport/세션 풀의 예기치 못한 RuntimeException → releasePermit, OPERATION 실패로 반환</li>
 * </ul>
 *
 * <p>동시에 여러 스레드에서 호출해도 안전합니다.
 * Circuit Breaker, Rate Limiter, 세션 풀은 엔진 인스턴스 단위로 공유됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RequestEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestEngine.class);

    private final EngineConfig config;
    private final String bearerToken;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final SessionPool sessionPool;
    private final RetryExecutor retryExecutor;
    private final AsyncOperationPoller poller;
    private final Ticker ticker;

    /**
     * 시스템 시계로 엔진 생성.
     *
     * @param config 엔진 설정
     * @param bearerToken 인증 토큰 (없으면 null)
     * @param transportFactory 호스트별 Transport 생성기
     * @param circuitBreaker 공유 Circuit Breaker
     * @param rateLimiter 공유 Rate Limiter
     * @throws IllegalArgumentException 인자가 null이거나 requireAuth인데 토큰이 없는 경우
     */
    public RequestEngine(
        EngineConfig config,
        String bearerToken,
        TransportFactory transportFactory,
        CircuitBreaker circuitBreaker,
        RateLimiter rateLimiter
    ) {
        this(config, bearerToken, transportFactory, circuitBreaker, rateLimiter, Ticker.system(), Sleeper.system(), null);
    }

    /**
     * 시간원/난수 주입 생성자.
     *
     * @param ticker 단조 시계
     * @param sleeper 대기 구현
     * @param random jitter 난수 (null이면 ThreadLocalRandom)
     */
    public RequestEngine(
        EngineConfig config,
        String bearerToken,
        TransportFactory transportFactory,
        CircuitBreaker circuitBreaker,
        RateLimiter rateLimiter,
        Ticker ticker,
        Sleeper sleeper,
        RandomGenerator random
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (transportFactory == null) {
            throw new IllegalArgumentException("transportFactory cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (config.requireAuth() && (bearerToken == null || bearerToken.isBlank())) {
            throw new IllegalArgumentException("bearerToken is required when requireAuth is enabled");
        }

        this.config = config;
        this.bearerToken = bearerToken == null || bearerToken.isBlank() ? null : bearerToken;
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.ticker = ticker;
        this.sessionPool = new SessionPool(transportFactory, config.sessionPool(), ticker);

        ResponseClassifier classifier = new ResponseClassifier(Clock.systemUTC());
        this.retryExecutor = new RetryExecutor(
            config.retry(),
            config.requestTimeout(),
            sessionPool,
            rateLimiter,
            circuitBreaker,
            classifier,
            ticker,
            sleeper,
            random
        );
        this.poller = new AsyncOperationPoller(
            config.poller(),
            config.retry(),
            retryExecutor,
            classifier,
            rateLimiter,
            ticker,
            sleeper,
            random
        );

        log.info("RequestEngine initialized: rate={}/s, maxRetries={}, breakerThreshold={}, maxSessions={}, auth={}",
            config.rateLimiter().isUnlimited() ? "unlimited" : config.rateLimiter().callsPerSecond(),
            config.retry().maxRetries(),
            config.circuitBreaker().failureThreshold(),
            config.sessionPool().maxSessions(),
            this.bearerToken != null);
    }

    // ============================================================
    // HTTP 메서드 (실패 시 RelayException)
    // ============================================================

    public OperationResult get(String url) {
        return get(url, RequestOptions.defaults());
    }

    public OperationResult get(String url, RequestOptions options) {
        return call(HttpMethod.GET, url, Payload.empty(), options);
    }

    public OperationResult post(String url, Payload body) {
        return post(url, body, RequestOptions.defaults());
    }

    public OperationResult post(String url, Payload body, RequestOptions options) {
        return call(HttpMethod.POST, url, body, options);
    }

    public OperationResult put(String url, Payload body) {
        return put(url, body, RequestOptions.defaults());
    }

    public OperationResult put(String url, Payload body, RequestOptions options) {
        return call(HttpMethod.PUT, url, body, options);
    }

    public OperationResult patch(String url, Payload body) {
        return patch(url, body, RequestOptions.defaults());
    }

    public OperationResult patch(String url, Payload body, RequestOptions options) {
        return call(HttpMethod.PATCH, url, body, options);
    }

    public OperationResult delete(String url) {
        return delete(url, RequestOptions.defaults());
    }

    public OperationResult delete(String url, RequestOptions options) {
        return call(HttpMethod.DELETE, url, Payload.empty(), options);
    }

    private OperationResult call(HttpMethod method, String url, Payload body, RequestOptions options) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        RequestSpec request = new RequestSpec(method, URI.create(url), Map.of(), body, method.isIdempotent());
        return execute(request, options).orThrow();
    }

    // ============================================================
    // 논리 호출
    // ============================================================

    /**
     * 논리 호출 실행 (예외 없이 결과 반환).
     *
     * @param request 요청 (헤더는 엔진 기본 헤더 위에 덮어씀)
     * @param options 호출 옵션 (null이면 기본값)
     * @return 성공 또는 분류된 실패 결과
     */
    public OperationResult execute(RequestSpec request, RequestOptions options) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        RequestOptions effective = options == null ? RequestOptions.defaults() : options;
        long startNanos = ticker.read();
        RequestSpec prepared = prepare(request, effective);
        CallContext context = effective.toContext(ticker);
        String host = prepared.url().getHost();

        // 1. Circuit Breaker
        if (!circuitBreaker.tryAcquire()) {
            log.warn("[{}] Circuit breaker OPEN, rejecting {} {}", host, prepared.method(), prepared.url().getPath());
            return OperationResult.failure(ErrorKind.CIRCUIT_OPEN, "circuit breaker is open for " + host,
                null, null, 0, 0, elapsedSince(startNanos));
        }

        try {
            return admitted(prepared, context, startNanos);
        } catch (RuntimeException e) {
            // Transport/세션 풀의 예기치 못한 예외: 판정 없이 허가 반환
            circuitBreaker.releasePermit();
            log.error("[{}] Unexpected error during {} {}: {}", host, prepared.method(), prepared.url().getPath(), e.toString(), e);
            return OperationResult.failure(ErrorKind.OPERATION, "unexpected error: " + e,
                null, null, 0, 0, elapsedSince(startNanos));
        }
    }

    private OperationResult admitted(RequestSpec prepared, CallContext context, long startNanos) {
        // 2. Rate Limit
        try {
            rateLimiter.acquire(context);
        } catch (CallAbortedException e) {
            circuitBreaker.releasePermit();
            return aborted(e, 0, 0, startNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            circuitBreaker.releasePermit();
            return OperationResult.failure(ErrorKind.CANCELLED, "interrupted while waiting for rate limiter",
                null, null, 0, 0, elapsedSince(startNanos));
        }

        // 3. 재시도 루프
        RetryResult retried = retryExecutor.execute(prepared, context);
        Outcome outcome = retried.outcome();
        int attempts = retried.attempts();
        int polls = 0;

        // 4. 비동기 작업 폴링
        if (outcome instanceof Pending pending) {
            PollResult polled = poller.poll(prepared, pending, context);
            outcome = polled.outcome();
            attempts += polled.attempts();
            polls = polled.polls();
        }

        // 5. Circuit Breaker 기록
        recordOnBreaker(outcome);

        // 6. 결과
        return toResult(outcome, attempts, polls, startNanos);
    }

    private RequestSpec prepare(RequestSpec request, RequestOptions options) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(config.defaultHeaders());
        if (bearerToken != null) {
            headers.put("Authorization", "Bearer " + bearerToken);
        }
        headers.putAll(request.headers());
        headers.putAll(options.headers());
        if (options.ifMatch() != null) {
            headers.put("If-Match", options.ifMatch());
        }
        boolean idempotent = options.idempotent() != null ? options.idempotent() : request.idempotent();
        return new RequestSpec(request.method(), request.url(), headers, request.body(), idempotent);
    }

    private void recordOnBreaker(Outcome outcome) {
        if (outcome instanceof Ok) {
            circuitBreaker.recordSuccess();
            return;
        }
        Fail fail = (Fail) outcome;
        if (fail.dependencyFailure()) {
            circuitBreaker.recordFailure(fail.cause());
        } else if (fail.kind() == ErrorKind.CANCELLED || fail.cause() instanceof CallAbortedException) {
            // 호출자 취소, 호출 마감 초과
            circuitBreaker.releasePermit();
        } else {
            circuitBreaker.recordSuccess();
        }
    }

    private OperationResult toResult(Outcome outcome, int attempts, int polls, long startNanos) {
        Duration elapsed = elapsedSince(startNanos);
        if (outcome instanceof Ok ok) {
            TransportResponse response = ok.response();
            return OperationResult.success(response.statusCode(), response.body(), attempts, polls, elapsed);
        }
        Fail fail = (Fail) outcome;
        TransportResponse response = fail.response();
        return OperationResult.failure(
            fail.kind(),
            fail.reason(),
            response == null ? null : response.statusCode(),
            response == null ? null : response.body(),
            attempts,
            polls,
            elapsed
        );
    }

    private OperationResult aborted(CallAbortedException e, int attempts, int polls, long startNanos) {
        if (e.getReason() == CallAbortedException.Reason.CANCELLED) {
            return OperationResult.failure(ErrorKind.CANCELLED, "request cancelled", null, null, attempts, polls, elapsedSince(startNanos));
        }
        return OperationResult.failure(ErrorKind.TIMEOUT, "call deadline exceeded while waiting for rate limiter",
            null, null, attempts, polls, elapsedSince(startNanos));
    }

    private Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(Math.max(0L, ticker.read() - startNanos));
    }

    // ============================================================
    // 조회 / 종료
    // ============================================================

    public EngineConfig getConfig() {
        return config;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public SessionPool getSessionPool() {
        return sessionPool;
    }

    /**
     * 세션 풀의 모든 Transport 종료.
     */
    @Override
    public void close() {
        sessionPool.close();
        log.info("RequestEngine closed");
    }
}
