package com.ryuqq.relay.engine.config;

import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.RateLimiterConfig;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * RequestEngine 전체 설정 (불변 record).
 *
 * <p>모든 하위 설정은 생성 시점에 검증되며, 잘못된 값은
 * {@link IllegalArgumentException}으로 즉시 실패합니다.</p>
 *
 * <p><strong>Properties 키 (모두 필수):</strong></p>
 * <pre>
 * relay.rate-limit.calls-per-second      relay.rate-limit.burst-size
 * relay.circuit-breaker.failure-threshold relay.circuit-breaker.timeout-seconds
 * relay.retry.max-retries                relay.retry.base-delay-seconds
 * relay.retry.backoff-factor             relay.retry.max-delay-seconds
 * relay.retry.jitter-min-factor          relay.retry.jitter-max-factor
 * relay.session.max-sessions
 * relay.async.poll-interval-seconds      relay.async.max-wait-seconds
 * relay.request.timeout-seconds          relay.auth.required
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param rateLimiter Rate Limiter 설정
 * @param circuitBreaker Circuit Breaker 설정
 * @param retry 재시도 설정
 * @param poller 비동기 폴링 설정
 * @param sessionPool 세션 풀 설정
 * @param requestTimeout 시도당 타임아웃 (양수)
 * @param requireAuth true면 bearer token 없이 엔진 생성 불가
 * @param defaultHeaders 모든 요청에 붙는 기본 헤더
 */
public record EngineConfig(
    RateLimiterConfig rateLimiter,
    CircuitBreakerConfig circuitBreaker,
    RetryConfig retry,
    PollerConfig poller,
    SessionPoolConfig sessionPool,
    Duration requestTimeout,
    boolean requireAuth,
    Map<String, String> defaultHeaders
) {

    /**
     * JSON API 기본 헤더.
     */
    public static final Map<String, String> JSON_HEADERS = Collections.unmodifiableMap(jsonHeaders());

    public EngineConfig {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (retry == null) {
            throw new IllegalArgumentException("retry cannot be null");
        }
        if (poller == null) {
            throw new IllegalArgumentException("poller cannot be null");
        }
        if (sessionPool == null) {
            throw new IllegalArgumentException("sessionPool cannot be null");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException(
                "requestTimeout must be positive (current: " + requestTimeout + ")"
            );
        }
        defaultHeaders = defaultHeaders == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(defaultHeaders));
    }

    /**
     * 기본값: rate 10/s burst 1, breaker 5회/60s, retry 기본값, poll 5s/300s,
     * session 50, requestTimeout 60s, requireAuth=false, JSON 기본 헤더.
     */
    public static EngineConfig defaults() {
        return new EngineConfig(
            RateLimiterConfig.defaults(),
            CircuitBreakerConfig.defaults(),
            RetryConfig.defaults(),
            PollerConfig.defaults(),
            SessionPoolConfig.defaults(),
            Duration.ofSeconds(60),
            false,
            JSON_HEADERS
        );
    }

    /**
     * Properties에서 설정 로드.
     *
     * <p>모든 키가 필수이며, 누락되거나 숫자 형식이 잘못된 키는 이름과 함께 즉시 실패합니다.
     * {@code defaultHeaders}는 {@link #JSON_HEADERS}로 설정됩니다.</p>
     *
     * @param properties 설정 소스
     * @return EngineConfig
     * @throws IllegalArgumentException 키 누락, 형식 오류, 값 검증 실패 시
     */
    public static EngineConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        RateLimiterConfig rateLimiter = new RateLimiterConfig(
            requireDouble(properties, "relay.rate-limit.calls-per-second"),
            requireDouble(properties, "relay.rate-limit.burst-size")
        );
        CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig(
            requireInt(properties, "relay.circuit-breaker.failure-threshold"),
            requireSeconds(properties, "relay.circuit-breaker.timeout-seconds")
        );
        RetryConfig retry = new RetryConfig(
            requireInt(properties, "relay.retry.max-retries"),
            requireSeconds(properties, "relay.retry.base-delay-seconds"),
            requireDouble(properties, "relay.retry.backoff-factor"),
            requireSeconds(properties, "relay.retry.max-delay-seconds"),
            requireDouble(properties, "relay.retry.jitter-min-factor"),
            requireDouble(properties, "relay.retry.jitter-max-factor")
        );
        SessionPoolConfig sessionPool = new SessionPoolConfig(
            requireInt(properties, "relay.session.max-sessions")
        );
        PollerConfig poller = new PollerConfig(
            requireSeconds(properties, "relay.async.poll-interval-seconds"),
            requireSeconds(properties, "relay.async.max-wait-seconds")
        );
        return new EngineConfig(
            rateLimiter,
            circuitBreaker,
            retry,
            poller,
            sessionPool,
            requireSeconds(properties, "relay.request.timeout-seconds"),
            requireBoolean(properties, "relay.auth.required"),
            JSON_HEADERS
        );
    }

    public EngineConfig withRateLimiter(RateLimiterConfig rateLimiter) {
        return new EngineConfig(rateLimiter, circuitBreaker, retry, poller, sessionPool, requestTimeout, requireAuth, defaultHeaders);
    }

    public EngineConfig withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new EngineConfig(rateLimiter, circuitBreaker, retry, poller, sessionPool, requestTimeout, requireAuth, defaultHeaders);
    }

    public EngineConfig withRetry(RetryConfig retry) {
        return new EngineConfig(rateLimiter, circuitBreaker, retry, poller, sessionPool, requestTimeout, requireAuth, defaultHeaders);
    }

    public EngineConfig withPoller(PollerConfig poller) {
        return new EngineConfig(rateLimiter, circuitBreaker, retry, poller, sessionPool, requestTimeout, requireAuth, defaultHeaders);
    }

    public EngineConfig withSessionPool(SessionPoolConfig sessionPool) {
        return new EngineConfig(rateLimiter, circuitBreaker, retry, poller, sessionPool, requestTimeout, requireAuth, defaultHeaders);
    }

    public EngineConfig withRequestTimeout(Duration requestTimeout) {
        return new EngineConfig(rateLimiter, circuitBreaker, retry, poller, sessionPool, requestTimeout, requireAuth, defaultHeaders);
    }

    public EngineConfig withRequireAuth(boolean requireAuth) {
        return new EngineConfig(rateLimiter, circuitBreaker, retry, poller, sessionPool, requestTimeout, requireAuth, defaultHeaders);
    }

    public EngineConfig withDefaultHeaders(Map<String, String> defaultHeaders) {
        return new EngineConfig(rateLimiter, circuitBreaker, retry, poller, sessionPool, requestTimeout, requireAuth, defaultHeaders);
    }

    private static Map<String, String> jsonHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Accept", "application/json");
        headers.put("Prefer", "return=representation");
        return headers;
    }

    private static String require(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required configuration key: " + key);
        }
        return value.trim();
    }

    private static int requireInt(Properties properties, String key) {
        String value = require(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static double requireDouble(Properties properties, String key) {
        String value = require(properties, key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static Duration requireSeconds(Properties properties, String key) {
        double seconds = requireDouble(properties, key);
        if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + seconds);
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000.0));
    }

    private static boolean requireBoolean(Properties properties, String key) {
        String value = require(properties, key);
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
    }
}
