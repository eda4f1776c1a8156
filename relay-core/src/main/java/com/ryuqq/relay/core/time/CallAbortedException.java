package com.ryuqq.relay.core.time;

/**
 * 대기 지점에서 호출이 중단되었음을 알리는 내부 신호.
 *
 * <p>엔진 경계에서 CANCELLED 또는 TIMEOUT 결과로 변환되며,
 * 호출자에게 그대로 노출되지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class CallAbortedException extends RuntimeException {

    /**
     * 중단 사유.
     */
    public enum Reason {
        CANCELLED,
        DEADLINE_EXCEEDED
    }

    private final Reason reason;

    private CallAbortedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static CallAbortedException cancelled() {
        return new CallAbortedException(Reason.CANCELLED, "Call cancelled by caller");
    }

    public static CallAbortedException deadlineExceeded() {
        return new CallAbortedException(Reason.DEADLINE_EXCEEDED, "Call deadline exceeded");
    }

    public Reason getReason() {
        return reason;
    }
}
