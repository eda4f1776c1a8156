package com.ryuqq.relay.engine.backoff;

import com.ryuqq.relay.engine.config.RetryConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되 상한으로 자르고, 마지막에 jitter 배수를 곱하여
 * 여러 클라이언트가 동시에 재시도하는 Thundering Herd를 방지합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay  = min(maxDelay, baseDelay * backoffFactor^attemptIndex)
 * result = delay * U(jitterMinFactor, jitterMaxFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1s, backoffFactor=3.0, maxDelay=60s, jitter=0.8~1.2):</strong></p>
 * <ul>
 *   <li>attemptIndex=0: 1s → 0.8 ~ 1.2s</li>
 *   <li>attemptIndex=1: 3s → 2.4 ~ 3.6s</li>
 *   <li>attemptIndex=2: 9s → 7.2 ~ 10.8s</li>
 *   <li>attemptIndex=5: 243s (capped at 60s) → 48 ~ 72s</li>
 * </ul>
 *
 * <p>서버가 제시한 대기 시간(Retry-After)은 줄이지 않고 위쪽으로만 jitter를 적용합니다
 * ({@link #jitterHint(Duration)}).</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final Duration baseDelay;
    private final double backoffFactor;
    private final Duration maxDelay;
    private final double jitterMinFactor;
    private final double jitterMaxFactor;
    private final RandomGenerator random;

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelay 기본 지연 (양수)
     * @param backoffFactor 지수 배수 (1.0 이상)
     * @param maxDelay 지연 상한 (baseDelay 이상)
     * @param jitterMinFactor jitter 하한 (0 이상)
     * @param jitterMaxFactor jitter 상한 (jitterMinFactor 이상)
     * @param random 난수 생성기 (null이면 ThreadLocalRandom)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(
        Duration baseDelay,
        double backoffFactor,
        Duration maxDelay,
        double jitterMinFactor,
        double jitterMaxFactor,
        RandomGenerator random
    ) {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException(
                "baseDelay must be positive (current: " + baseDelay + ")"
            );
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException(
                "backoffFactor must be >= 1.0 (current: " + backoffFactor + ")"
            );
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (jitterMinFactor < 0.0 || jitterMaxFactor < jitterMinFactor) {
            throw new IllegalArgumentException(
                "jitter range invalid (min: " + jitterMinFactor + ", max: " + jitterMaxFactor + ")"
            );
        }
        this.baseDelay = baseDelay;
        this.backoffFactor = backoffFactor;
        this.maxDelay = maxDelay;
        this.jitterMinFactor = jitterMinFactor;
        this.jitterMaxFactor = jitterMaxFactor;
        this.random = random;
    }

    /**
     * 재시도 설정으로 생성.
     */
    public static BackoffCalculator fromRetry(RetryConfig config, RandomGenerator random) {
        return new BackoffCalculator(
            config.baseDelay(),
            config.backoffFactor(),
            config.maxDelay(),
            config.jitterMinFactor(),
            config.jitterMaxFactor(),
            random
        );
    }

    /**
     * 고정 간격 (폴링용). 지수 증가 없이 interval에 jitter만 적용합니다.
     */
    public static BackoffCalculator fixedInterval(Duration interval, double jitterMinFactor, double jitterMaxFactor,
                                                  RandomGenerator random) {
        return new BackoffCalculator(interval, 1.0, interval, jitterMinFactor, jitterMaxFactor, random);
    }

    /**
     * jitter 적용 전 지연 시간.
     *
     * @param attemptIndex 0부터 시작하는 재시도 인덱스
     * @return min(maxDelay, baseDelay * backoffFactor^attemptIndex)
     * @throws IllegalArgumentException attemptIndex가 음수인 경우
     */
    public Duration delayFor(int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException(
                "attemptIndex must be non-negative (current: " + attemptIndex + ")"
            );
        }
        double nanos = baseDelay.toNanos() * Math.pow(backoffFactor, attemptIndex);
        if (Double.isInfinite(nanos) || nanos >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos((long) nanos);
    }

    /**
     * jitter 배수 적용.
     *
     * @param delay 기준 지연
     * @return delay * U(jitterMinFactor, jitterMaxFactor)
     */
    public Duration jitter(Duration delay) {
        return scale(delay, uniform(jitterMinFactor, jitterMaxFactor));
    }

    /**
     * 서버 힌트에 위쪽 jitter 적용.
     *
     * @param hint Retry-After 값
     * @return hint * U(1, max(1, jitterMaxFactor)), 항상 hint 이상
     */
    public Duration jitterHint(Duration hint) {
        return scale(hint, uniform(1.0, Math.max(1.0, jitterMaxFactor)));
    }

    /**
     * jitter 적용된 재시도 지연.
     */
    public Duration calculate(int attemptIndex) {
        return jitter(delayFor(attemptIndex));
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    private double uniform(double min, double max) {
        if (max <= min) {
            return min;
        }
        RandomGenerator generator = random != null ? random : ThreadLocalRandom.current();
        return generator.nextDouble(min, max);
    }

    private static Duration scale(Duration delay, double factor) {
        double nanos = delay.toNanos() * factor;
        if (nanos >= Long.MAX_VALUE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.round(nanos));
    }
}
