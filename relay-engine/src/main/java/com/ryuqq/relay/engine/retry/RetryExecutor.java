package com.ryuqq.relay.engine.retry;

import com.ryuqq.relay.core.model.RequestSpec;
import com.ryuqq.relay.core.outcome.Fail;
import com.ryuqq.relay.core.outcome.Outcome;
import com.ryuqq.relay.core.outcome.Retry;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.protection.RateLimiter;
import com.ryuqq.relay.core.result.ErrorKind;
import com.ryuqq.relay.core.spi.TransportResponse;
import com.ryuqq.relay.core.time.CallAbortedException;
import com.ryuqq.relay.core.time.CallContext;
import com.ryuqq.relay.core.time.Sleeper;
import com.ryuqq.relay.core.time.Ticker;
import com.ryuqq.relay.engine.backoff.BackoffBudget;
import com.ryuqq.relay.engine.backoff.BackoffCalculator;
import com.ryuqq.relay.engine.backoff.BackoffLoop;
import com.ryuqq.relay.engine.config.RetryConfig;
import com.ryuqq.relay.engine.session.SessionLease;
import com.ryuqq.relay.engine.session.SessionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.random.RandomGenerator;

/**
 * 요청 하나를 재시도 정책에 따라 최대 {@code maxRetries + 1}회 시도.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. (재시도일 때만) Rate Limit 토큰 획득
 * 2. 세션 대여 → 전송 (timeout = min(requestTimeout, 남은 마감 시간)) → 세션 반납
 * 3. 응답 분류 (ResponseClassifier)
 *    ├─ Ok / Pending / Fail → 즉시 반환
 *    └─ Retry
 *        ├─ 비멱등 요청 (429, 408 제외) → Fail
 *        ├─ 시도 소진 → Fail (마지막 오류)
 *        ├─ Circuit Breaker OPEN → Fail (재시도 중단)
 *        └─ 백오프 대기 후 1로
 * </pre>
 *
 * <p>Circuit Breaker에 결과를 기록하지 않습니다. 논리 호출당 한 번의 기록은
 * 호출자(RequestEngine)의 책임입니다.</p>
 *
 * <p>첫 시도의 Rate Limit 토큰은 호출자가 획득합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryConfig config;
    private final Duration requestTimeout;
    private final SessionPool sessionPool;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final ResponseClassifier classifier;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final RandomGenerator random;

    /**
     * @param config 재시도 설정
     * @param requestTimeout 시도당 타임아웃
     * @param sessionPool 세션 풀
     * @param rateLimiter 재시도마다 토큰을 얻을 Rate Limiter
     * @param circuitBreaker OPEN 여부만 조회하는 공유 Circuit Breaker
     * @param classifier 응답 분류기
     * @param ticker 단조 시계
     * @param sleeper 백오프 대기 구현
     * @param random jitter 난수 (null이면 ThreadLocalRandom)
     */
    public RetryExecutor(
        RetryConfig config,
        Duration requestTimeout,
        SessionPool sessionPool,
        RateLimiter rateLimiter,
        CircuitBreaker circuitBreaker,
        ResponseClassifier classifier,
        Ticker ticker,
        Sleeper sleeper,
        RandomGenerator random
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
        if (sessionPool == null) {
            throw new IllegalArgumentException("sessionPool cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.requestTimeout = requestTimeout;
        this.sessionPool = sessionPool;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.classifier = classifier;
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * 재시도 루프 실행.
     *
     * <p>분류된 결과를 반환하며 예외를 던지지 않습니다. 취소는 CANCELLED,
     * 호출 마감 초과는 TIMEOUT인 {@link Fail}로 반환됩니다.</p>
     *
     * @param request 요청
     * @param context 호출 컨텍스트
     * @return 최종 Outcome과 시도 횟수
     */
    public RetryResult execute(RequestSpec request, CallContext context) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        String host = request.url().getHost();
        BackoffLoop loop = BackoffLoop.start(
            BackoffCalculator.fromRetry(config, random),
            BackoffBudget.attempts(config.maxAttempts()),
            ticker,
            sleeper
        );

        try {
            while (true) {
                // 1. 재시도 전 Rate Limit
                if (loop.iterations() > 0) {
                    rateLimiter.acquire(context);
                }
                context.checkpoint();

                // 2. 시도
                loop.recordIteration();
                Outcome outcome = attempt(request, context);
                if (!(outcome instanceof Retry retry)) {
                    return new RetryResult(outcome, loop.iterations());
                }

                // 3. 재시도 여부 판단
                int attempts = loop.iterations();
                if (!request.idempotent() && !isSafeToRepeat(retry)) {
                    log.warn("[{}] {} {} failed: {} (not retried, request is not idempotent)",
                        host, request.method(), request.url().getPath(), retry.reason());
                    return new RetryResult(new Fail(retry.kind(), retry.reason(), retry.response(), retry.cause(), true), attempts);
                }
                if (!loop.hasRemaining()) {
                    log.warn("[{}] {} {} failed after {} attempts: {}",
                        host, request.method(), request.url().getPath(), attempts, retry.reason());
                    return new RetryResult(Fail.exhausted(retry, retry.reason() + " after " + attempts + " attempts"), attempts);
                }
                if (circuitBreaker.getState() == CircuitBreakerState.OPEN) {
                    log.warn("[{}] retries abandoned after {} attempts: circuit breaker opened", host, attempts);
                    return new RetryResult(new Fail(retry.kind(),
                        retry.reason() + " (retries abandoned: circuit breaker opened)",
                        retry.response(), retry.cause(), true), attempts);
                }

                // 4. 백오프
                Duration delay = loop.nextDelay(retry.retryAfterHint());
                log.warn("[{}] {} - retrying in {}ms (attempt {}/{})",
                    host, retry.reason(), delay.toMillis(), attempts + 1, config.maxAttempts());
                loop.sleep(delay, context);
            }
        } catch (CallAbortedException e) {
            return new RetryResult(aborted(e, host), loop.iterations());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new RetryResult(Fail.aborted(ErrorKind.CANCELLED, "interrupted while executing request", e), loop.iterations());
        }
    }

    private Outcome attempt(RequestSpec request, CallContext context) throws InterruptedException {
        Duration timeout = context.deadline().clamp(requestTimeout);
        try (SessionLease lease = sessionPool.lease(request.hostKey())) {
            TransportResponse response = lease.transport().send(request, timeout, context.cancellation());
            observeRateLimitHeaders(request, response);
            log.debug("[{}] {} {} -> {}", request.url().getHost(), request.method(), request.url().getPath(), response.statusCode());
            return classifier.classify(request, response);
        } catch (IOException e) {
            log.debug("[{}] {} {} -> {}", request.url().getHost(), request.method(), request.url().getPath(), e.toString());
            return classifier.networkFailure(e);
        } catch (CancellationException e) {
            throw CallAbortedException.cancelled();
        }
    }

    // 429, 408은 서버가 요청을 처리하지 않았음을 뜻하므로 비멱등 요청도 재전송 가능
    private static boolean isSafeToRepeat(Retry retry) {
        Integer status = retry.statusCode();
        return retry.kind() == ErrorKind.RATE_LIMITED || (status != null && status == 408);
    }

    private static void observeRateLimitHeaders(RequestSpec request, TransportResponse response) {
        if (!log.isDebugEnabled()) {
            return;
        }
        String limit = response.header("X-RateLimit-Limit").orElse(null);
        String remaining = response.header("X-RateLimit-Remaining").orElse(null);
        if (limit != null || remaining != null) {
            log.debug("[{}] server rate limit: remaining={}, limit={}", request.url().getHost(), remaining, limit);
        }
    }

    private static Fail aborted(CallAbortedException e, String host) {
        if (e.getReason() == CallAbortedException.Reason.CANCELLED) {
            log.info("[{}] request cancelled by caller", host);
            return Fail.aborted(ErrorKind.CANCELLED, "request cancelled", e);
        }
        log.warn("[{}] call deadline exceeded", host);
        return Fail.aborted(ErrorKind.TIMEOUT, "call deadline exceeded", e);
    }
}
