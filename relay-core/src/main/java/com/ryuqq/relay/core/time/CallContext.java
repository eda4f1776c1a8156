package com.ryuqq.relay.core.time;

/**
 * 논리 호출 하나의 마감/취소 컨텍스트.
 *
 * <p>모든 대기 지점(Rate Limit, 백오프, 네트워크 I/O)이 이 컨텍스트를 확인합니다.</p>
 *
 * @param deadline 전체 마감 시각
 * @param cancellation 호출자 취소 신호
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record CallContext(Deadline deadline, CancellationToken cancellation) {

    private static final CallContext NONE = new CallContext(Deadline.none(), CancellationToken.none());

    public CallContext {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }
    }

    /**
     * 마감/취소 없는 컨텍스트.
     *
     * @return 무제한 컨텍스트
     */
    public static CallContext none() {
        return NONE;
    }

    /**
     * 취소 또는 마감 여부 확인.
     *
     * @throws CallAbortedException 취소되었거나 마감을 넘긴 경우
     */
    public void checkpoint() {
        if (cancellation.isCancelled()) {
            throw CallAbortedException.cancelled();
        }
        if (deadline.isExpired()) {
            throw CallAbortedException.deadlineExceeded();
        }
    }
}
