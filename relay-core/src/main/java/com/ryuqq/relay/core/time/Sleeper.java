package com.ryuqq.relay.core.time;

import java.time.Duration;

/**
 * 취소 가능한 대기.
 *
 * <p>백오프 대기, Rate Limit 대기, 폴링 간격 대기가 모두 이 인터페이스를 거칩니다.
 * 대기 중 호출이 취소되면 즉시 깨어나 {@link CallAbortedException}을 던집니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정 시간 동안 대기.
     *
     * @param duration 대기 시간 (0 이하이면 즉시 반환)
     * @param context 호출 컨텍스트 (취소 신호)
     * @throws InterruptedException 대기 중 인터럽트 발생
     * @throws CallAbortedException 대기 중 호출이 취소된 경우
     */
    void sleep(Duration duration, CallContext context) throws InterruptedException;

    /**
     * {@link CancellationToken} 래치로 대기하는 기본 구현.
     *
     * @return 시스템 Sleeper
     */
    static Sleeper system() {
        return (duration, context) -> {
            if (context.cancellation().await(duration)) {
                throw CallAbortedException.cancelled();
            }
        };
    }
}
