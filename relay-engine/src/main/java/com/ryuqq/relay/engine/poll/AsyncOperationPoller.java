package com.ryuqq.relay.engine.poll;

import com.ryuqq.relay.core.model.HttpMethod;
import com.ryuqq.relay.core.model.Payload;
import com.ryuqq.relay.core.model.RequestSpec;
import com.ryuqq.relay.core.outcome.Fail;
import com.ryuqq.relay.core.outcome.Ok;
import com.ryuqq.relay.core.outcome.Outcome;
import com.ryuqq.relay.core.outcome.Pending;
import com.ryuqq.relay.core.protection.RateLimiter;
import com.ryuqq.relay.core.result.ErrorKind;
import com.ryuqq.relay.core.time.CallAbortedException;
import com.ryuqq.relay.core.time.CallContext;
import com.ryuqq.relay.core.time.Sleeper;
import com.ryuqq.relay.core.time.Ticker;
import com.ryuqq.relay.engine.backoff.BackoffBudget;
import com.ryuqq.relay.engine.backoff.BackoffCalculator;
import com.ryuqq.relay.engine.backoff.BackoffLoop;
import com.ryuqq.relay.engine.config.PollerConfig;
import com.ryuqq.relay.engine.config.RetryConfig;
import com.ryuqq.relay.engine.retry.ResponseClassifier;
import com.ryuqq.relay.engine.retry.RetryExecutor;
import com.ryuqq.relay.engine.retry.RetryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.random.RandomGenerator;

/**
 * 202 Accepted 응답의 Location을 완료될 때까지 폴링.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * while (경과 시간 &lt; maxWait):
 *   1. 대기 (Retry-After 힌트 또는 pollInterval, jitter 적용)
 *   2. Rate Limit 토큰 획득
 *   3. GET location (RetryExecutor 경유, 일시적 오류는 재시도)
 *   4. 202 → 힌트/Location 갱신 후 계속
 *      2xx → 완료
 *      그 외 → 실패 반환
 * 경과 시간 초과 → Fail(TIMEOUT)
 * </pre>
 *
 * <p>폴링 요청은 원래 요청의 헤더(인증 포함)를 그대로 사용하고, 본문 없이 보냅니다.
 * 202 응답은 Circuit Breaker 실패로 취급하지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class AsyncOperationPoller {

    private static final Logger log = LoggerFactory.getLogger(AsyncOperationPoller.class);

    private final PollerConfig config;
    private final RetryConfig retryConfig;
    private final RetryExecutor retryExecutor;
    private final ResponseClassifier classifier;
    private final RateLimiter rateLimiter;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final RandomGenerator random;

    /**
     * @param config 폴링 설정
     * @param retryConfig jitter 범위를 공유할 재시도 설정
     * @param retryExecutor 폴링 GET을 실행할 재시도 실행기
     * @param classifier Retry-After 해석에 사용할 분류기
     * @param rateLimiter 폴링 요청마다 토큰을 얻을 Rate Limiter
     * @param ticker 단조 시계
     * @param sleeper 대기 구현
     * @param random jitter 난수 (null이면 ThreadLocalRandom)
     */
    public AsyncOperationPoller(
        PollerConfig config,
        RetryConfig retryConfig,
        RetryExecutor retryExecutor,
        ResponseClassifier classifier,
        RateLimiter rateLimiter,
        Ticker ticker,
        Sleeper sleeper,
        RandomGenerator random
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (retryConfig == null) {
            throw new IllegalArgumentException("retryConfig cannot be null");
        }
        if (retryExecutor == null) {
            throw new IllegalArgumentException("retryExecutor cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
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
        this.config = config;
        this.retryConfig = retryConfig;
        this.retryExecutor = retryExecutor;
        this.classifier = classifier;
        this.rateLimiter = rateLimiter;
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * 완료 또는 maxWait 초과까지 폴링.
     *
     * @param origin 202를 받은 원래 요청 (헤더 재사용)
     * @param accepted 202 분류 결과
     * @param context 호출 컨텍스트
     * @return 완료 응답(Ok) 또는 Fail, 시도/폴링 횟수
     */
    public PollResult poll(RequestSpec origin, Pending accepted, CallContext context) {
        if (origin == null) {
            throw new IllegalArgumentException("origin cannot be null");
        }
        if (accepted == null) {
            throw new IllegalArgumentException("accepted cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        String host = origin.url().getHost();
        PendingOperation operation = new PendingOperation(accepted.location(), ticker.read(), accepted.retryAfterHint());
        BackoffLoop loop = BackoffLoop.start(
            BackoffCalculator.fixedInterval(config.pollInterval(), retryConfig.jitterMinFactor(), retryConfig.jitterMaxFactor(), random),
            BackoffBudget.wallClock(config.maxWait()),
            ticker,
            sleeper
        );
        log.info("[{}] Async operation started, polling {}", host, operation.location());

        int attempts = 0;
        try {
            while (loop.hasRemaining()) {
                // 1. 대기
                loop.pause(operation.retryAfterHint(), context);
                loop.recordIteration();

                // 2. Rate Limit
                rateLimiter.acquire(context);

                // 3. 상태 조회
                RetryResult result = retryExecutor.execute(statusRequest(origin, operation.location()), context);
                attempts += result.attempts();
                Outcome outcome = result.outcome();

                // 4. 결과 판정
                if (outcome instanceof Ok ok) {
                    if (ok.response().statusCode() == 202) {
                        operation = operation.withUpdate(null, classifier.retryAfter(ok.response()));
                        log.debug("[{}] Async operation still pending (poll {})", host, loop.iterations());
                        continue;
                    }
                    log.info("[{}] Async operation completed after {} polls in {}ms",
                        host, loop.iterations(), loop.elapsed().toMillis());
                    return new PollResult(ok, attempts, loop.iterations());
                }
                if (outcome instanceof Pending pending) {
                    operation = operation.withUpdate(pending.location(), pending.retryAfterHint());
                    log.debug("[{}] Async operation still pending (poll {}), next location {}",
                        host, loop.iterations(), operation.location());
                    continue;
                }
                Fail fail = (Fail) outcome;
                log.warn("[{}] Async operation failed after {} polls: {}", host, loop.iterations(), fail.reason());
                return new PollResult(fail, attempts, loop.iterations());
            }
        } catch (CallAbortedException e) {
            ErrorKind kind = e.getReason() == CallAbortedException.Reason.CANCELLED ? ErrorKind.CANCELLED : ErrorKind.TIMEOUT;
            String reason = kind == ErrorKind.CANCELLED ? "async operation polling cancelled" : "call deadline exceeded while polling";
            log.warn("[{}] {}", host, reason);
            return new PollResult(Fail.aborted(kind, reason, e), attempts, loop.iterations());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new PollResult(Fail.aborted(ErrorKind.CANCELLED, "interrupted while polling", e), attempts, loop.iterations());
        }

        String reason = String.format("Async operation timed out after %ds (%d polls)",
            config.maxWait().toSeconds(), loop.iterations());
        log.warn("[{}] {}", host, reason);
        return new PollResult(new Fail(ErrorKind.TIMEOUT, reason, null, null, false), attempts, loop.iterations());
    }

    private static RequestSpec statusRequest(RequestSpec origin, URI location) {
        return new RequestSpec(HttpMethod.GET, location, origin.headers(), Payload.empty(), true);
    }
}
