package com.ryuqq.relay.core.time;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 호출자가 전달하는 취소 신호.
 *
 * <p>한 번 취소되면 되돌릴 수 없습니다. 대기 중인 스레드는 {@link #await(Duration)}에서
 * 즉시 깨어나고, 등록된 콜백(예: 진행 중인 HTTP 요청 취소)이 실행됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CancellationToken token = CancellationToken.create();
 * RequestOptions options = RequestOptions.defaults().withCancellation(token);
 *
 * // 다른 스레드에서
 * token.cancel();
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new ArrayList<>();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * 새 취소 토큰 생성.
     *
     * @return 취소 가능한 토큰
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * 절대 취소되지 않는 공유 토큰.
     *
     * @return 취소 불가 토큰
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * 취소 신호 발행.
     *
     * <p>이미 취소된 경우 아무 동작도 하지 않습니다.</p>
     *
     * @throws UnsupportedOperationException {@link #none()} 토큰에 호출한 경우
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        List<Runnable> toRun;
        synchronized (this) {
            if (latch.getCount() == 0) {
                return;
            }
            latch.countDown();
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * 취소되거나 시간이 다 될 때까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 취소되었으면 true, 시간이 다 되었으면 false
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            return isCancelled();
        }
        return latch.await(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
    }

    /**
     * 취소 시 실행할 콜백 등록.
     *
     * <p>이미 취소된 상태라면 호출 스레드에서 즉시 실행합니다.</p>
     *
     * @param action 콜백
     * @return 등록 해제 핸들 (try-with-resources로 사용)
     */
    public Registration onCancel(Runnable action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (!cancellable) {
            return () -> { };
        }
        synchronized (this) {
            if (latch.getCount() != 0) {
                callbacks.add(action);
                return () -> {
                    synchronized (CancellationToken.this) {
                        callbacks.remove(action);
                    }
                };
            }
        }
        action.run();
        return () -> { };
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * 콜백 등록 해제 핸들.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
