package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.time.CallContext;

import java.time.Duration;

/**
 * Rate Limiter SPI.
 *
 * <p>초당 요청 수를 제한하여 원격 API의 Rate Limit(429)에 걸리기 전에 호출 속도를 조절합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Duration waited = limiter.acquire(context);
 * log.debug("Rate limiter waited {}ms", waited.toMillis());
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 토큰 하나를 즉시 얻을 수 있으면 소비 (비블로킹).
     *
     * @return true: 토큰 소비, false: 토큰 부족
     */
    boolean tryAcquire();

    /**
     * 토큰을 얻을 때까지 대기한 뒤 하나를 소비.
     *
     * <p>대기 중 호출 마감/취소를 확인하며, 락은 장부 갱신 동안에만 잡습니다.</p>
     *
     * @param context 호출 컨텍스트
     * @return 실제 대기한 시간
     * @throws InterruptedException 대기 중 인터럽트 발생
     * @throws com.ryuqq.relay.core.time.CallAbortedException 취소되었거나 마감 전에 토큰을 얻을 수 없는 경우
     */
    Duration acquire(CallContext context) throws InterruptedException;

    /**
     * Rate Limiter 설정 조회.
     *
     * @return 설정
     */
    RateLimiterConfig getConfig();
}
