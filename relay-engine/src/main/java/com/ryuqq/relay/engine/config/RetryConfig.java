package com.ryuqq.relay.engine.config;

import java.time.Duration;

/**
 * RetryExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: 첫 시도 이후 추가 재시도 횟수 (기본 3, 총 시도 = maxRetries + 1)</li>
 *   <li>baseDelay: 첫 재시도 전 기본 지연 (기본 1s)</li>
 *   <li>backoffFactor: 재시도마다 곱해지는 배수 (기본 2.0)</li>
 *   <li>maxDelay: 지연 상한 (기본 60s)</li>
 *   <li>jitterMinFactor / jitterMaxFactor: 지연에 곱하는 난수 범위 (기본 0.8 ~ 1.2)</li>
 * </ul>
 *
 * <p><strong>예시 (baseDelay=1s, backoffFactor=2.0, jitter 0.8~1.2):</strong></p>
 * <ul>
 *   <li>1번째 재시도: 0.8 ~ 1.2s</li>
 *   <li>2번째 재시도: 1.6 ~ 2.4s</li>
 *   <li>3번째 재시도: 3.2 ~ 4.8s</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param baseDelay 기본 지연 (양수)
 * @param backoffFactor 지수 배수 (1.0 이상)
 * @param maxDelay 지연 상한 (baseDelay 이상)
 * @param jitterMinFactor jitter 하한 (0 이상)
 * @param jitterMaxFactor jitter 상한 (jitterMinFactor 이상)
 */
public record RetryConfig(
    int maxRetries,
    Duration baseDelay,
    double backoffFactor,
    Duration maxDelay,
    double jitterMinFactor,
    double jitterMaxFactor
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException(
                "baseDelay must be positive (current: " + baseDelay + ")"
            );
        }
        if (Double.isNaN(backoffFactor) || Double.isInfinite(backoffFactor) || backoffFactor < 1.0) {
            throw new IllegalArgumentException(
                "backoffFactor must be >= 1.0 (current: " + backoffFactor + ")"
            );
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (Double.isNaN(jitterMinFactor) || jitterMinFactor < 0.0) {
            throw new IllegalArgumentException(
                "jitterMinFactor must be non-negative (current: " + jitterMinFactor + ")"
            );
        }
        if (Double.isNaN(jitterMaxFactor) || Double.isInfinite(jitterMaxFactor) || jitterMaxFactor < jitterMinFactor) {
            throw new IllegalArgumentException(
                "jitterMaxFactor must be >= jitterMinFactor (min: " + jitterMinFactor + ", max: " + jitterMaxFactor + ")"
            );
        }
    }

    /**
     * 기본값: maxRetries=3, baseDelay=1s, backoffFactor=2.0, maxDelay=60s, jitter=0.8~1.2
     */
    public static RetryConfig defaults() {
        return new RetryConfig(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60), 0.8, 1.2);
    }

    /**
     * 총 시도 횟수 (첫 시도 포함).
     */
    public int maxAttempts() {
        return maxRetries + 1;
    }

    public RetryConfig withMaxRetries(int maxRetries) {
        return new RetryConfig(maxRetries, baseDelay, backoffFactor, maxDelay, jitterMinFactor, jitterMaxFactor);
    }

    public RetryConfig withBaseDelay(Duration baseDelay) {
        return new RetryConfig(maxRetries, baseDelay, backoffFactor, maxDelay, jitterMinFactor, jitterMaxFactor);
    }

    public RetryConfig withBackoffFactor(double backoffFactor) {
        return new RetryConfig(maxRetries, baseDelay, backoffFactor, maxDelay, jitterMinFactor, jitterMaxFactor);
    }

    public RetryConfig withMaxDelay(Duration maxDelay) {
        return new RetryConfig(maxRetries, baseDelay, backoffFactor, maxDelay, jitterMinFactor, jitterMaxFactor);
    }

    /**
     * jitter 범위 변경. min == max이면 jitter 없이 고정 배수.
     */
    public RetryConfig withJitter(double jitterMinFactor, double jitterMaxFactor) {
        return new RetryConfig(maxRetries, baseDelay, backoffFactor, maxDelay, jitterMinFactor, jitterMaxFactor);
    }
}
