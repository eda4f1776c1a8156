package com.ryuqq.relay.core.time;

/**
 * 단조 증가 시간원 (나노초).
 *
 * <p>경과 시간 측정, 토큰 버킷 리필, Circuit Breaker 타임아웃 계산에 사용됩니다.
 * 테스트에서는 수동으로 진행시키는 구현으로 교체할 수 있습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Ticker {

    /**
     * 현재 시각 (나노초, 임의의 기준점).
     *
     * @return 나노초 단위 시각
     */
    long read();

    /**
     * {@link System#nanoTime()} 기반 Ticker.
     *
     * @return 시스템 Ticker
     */
    static Ticker system() {
        return System::nanoTime;
    }
}
