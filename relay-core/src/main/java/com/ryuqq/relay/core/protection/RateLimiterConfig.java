package com.ryuqq.relay.core.protection;

/**
 * Rate Limiter 설정 (Token Bucket).
 *
 * <p>{@code callsPerSecond == 0}은 무제한 모드이며, 이 경우 acquire()는 아무것도 하지 않습니다.</p>
 *
 * @param callsPerSecond 초당 토큰 리필 속도 (0이면 무제한)
 * @param burstSize 버킷 용량, 1 이상 (1이면 버스트 없음)
 * @author Relay Team
 * @since 1.0.0
 */
public record RateLimiterConfig(double callsPerSecond, double burstSize) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException callsPerSecond가 음수/NaN이거나 burstSize가 1 미만인 경우
     */
    public RateLimiterConfig {
        if (Double.isNaN(callsPerSecond) || Double.isInfinite(callsPerSecond) || callsPerSecond < 0) {
            throw new IllegalArgumentException("callsPerSecond must be zero (unlimited) or positive (current: " + callsPerSecond + ")");
        }
        if (Double.isNaN(burstSize) || Double.isInfinite(burstSize) || burstSize < 1.0) {
            throw new IllegalArgumentException("burstSize must be >= 1 (current: " + burstSize + ")");
        }
    }

    /**
     * 기본값: 10 calls/s, burst 1.
     */
    public static RateLimiterConfig defaults() {
        return new RateLimiterConfig(10.0, 1.0);
    }

    /**
     * 무제한 설정.
     */
    public static RateLimiterConfig unlimited() {
        return new RateLimiterConfig(0.0, 1.0);
    }

    public boolean isUnlimited() {
        return callsPerSecond == 0.0;
    }

    public RateLimiterConfig withCallsPerSecond(double callsPerSecond) {
        return new RateLimiterConfig(callsPerSecond, burstSize);
    }

    public RateLimiterConfig withBurstSize(double burstSize) {
        return new RateLimiterConfig(callsPerSecond, burstSize);
    }
}
