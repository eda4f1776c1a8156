package com.ryuqq.relay.core.time;

import java.time.Duration;

/**
 * 논리 호출 전체에 적용되는 마감 시각.
 *
 * <p>Rate Limit 대기, 백오프 대기, 시도당 타임아웃은 모두 남은 시간으로 잘립니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class Deadline {

    private static final Duration UNBOUNDED = Duration.ofNanos(Long.MAX_VALUE);
    private static final Deadline NONE = new Deadline(null, 0L);

    private final Ticker ticker;
    private final long deadlineNanos;

    private Deadline(Ticker ticker, long deadlineNanos) {
        this.ticker = ticker;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * 마감 없음.
     *
     * @return 무제한 Deadline
     */
    public static Deadline none() {
        return NONE;
    }

    /**
     * 지금부터 timeout 후에 만료되는 Deadline.
     *
     * @param timeout 허용 시간 (양수)
     * @param ticker 시간원
     * @return Deadline 인스턴스
     * @throws IllegalArgumentException timeout이 양수가 아니거나 ticker가 null인 경우
     */
    public static Deadline after(Duration timeout, Ticker ticker) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        long now = ticker.read();
        long timeoutNanos = timeout.compareTo(UNBOUNDED) >= 0 ? Long.MAX_VALUE : timeout.toNanos();
        long deadline = now + timeoutNanos;
        // overflow
        if (deadline < now) {
            deadline = Long.MAX_VALUE;
        }
        return new Deadline(ticker, deadline);
    }

    public boolean isBounded() {
        return ticker != null;
    }

    public boolean isExpired() {
        return isBounded() && ticker.read() - deadlineNanos >= 0;
    }

    /**
     * 남은 시간.
     *
     * @return 남은 시간 (만료 시 {@link Duration#ZERO}, 무제한이면 매우 큰 값)
     */
    public Duration remaining() {
        if (!isBounded()) {
            return UNBOUNDED;
        }
        long left = deadlineNanos - ticker.read();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    /**
     * 주어진 시간을 남은 시간 이하로 자름.
     *
     * @param duration 원래 시간
     * @return min(duration, remaining)
     */
    public Duration clamp(Duration duration) {
        Duration left = remaining();
        return duration.compareTo(left) <= 0 ? duration : left;
    }

    @Override
    public String toString() {
        return isBounded() ? "Deadline{remaining=" + remaining().toMillis() + "ms}" : "Deadline{none}";
    }
}
