package com.ryuqq.relay.engine.backoff;

import com.ryuqq.relay.core.time.CallAbortedException;
import com.ryuqq.relay.core.time.CallContext;
import com.ryuqq.relay.core.time.Sleeper;
import com.ryuqq.relay.core.time.Ticker;

import java.time.Duration;

/**
 * 재시도 루프와 폴링 루프가 공유하는 백오프 반복자.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * BackoffLoop loop = BackoffLoop.start(calculator, BackoffBudget.attempts(4), ticker, sleeper);
 * while (true) {
 *     loop.recordIteration();
 *     Outcome outcome = attempt();
 *     if (!(outcome instanceof Retry retry) || !loop.hasRemaining()) {
 *         break;
 *     }
 *     loop.pause(retry.retryAfterHint(), context);
 * }
 * }</pre>
 *
 * <p>스레드 하나가 하나의 논리 호출 동안만 사용합니다 (thread-safe 아님).</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class BackoffLoop {

    private final BackoffCalculator calculator;
    private final BackoffBudget budget;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final long startNanos;
    private int iterations;

    private BackoffLoop(BackoffCalculator calculator, BackoffBudget budget, Ticker ticker, Sleeper sleeper) {
        this.calculator = calculator;
        this.budget = budget;
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.startNanos = ticker.read();
    }

    public static BackoffLoop start(BackoffCalculator calculator, BackoffBudget budget, Ticker ticker, Sleeper sleeper) {
        if (calculator == null) {
            throw new IllegalArgumentException("calculator cannot be null");
        }
        if (budget == null) {
            throw new IllegalArgumentException("budget cannot be null");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        return new BackoffLoop(calculator, budget, ticker, sleeper);
    }

    /**
     * 한도 안에서 한 번 더 반복할 수 있는지.
     */
    public boolean hasRemaining() {
        return budget.allows(iterations, elapsed());
    }

    public void recordIteration() {
        iterations++;
    }

    public int iterations() {
        return iterations;
    }

    public Duration elapsed() {
        return Duration.ofNanos(Math.max(0L, ticker.read() - startNanos));
    }

    /**
     * 다음 반복 전 대기.
     *
     * <p>서버 힌트가 있으면 힌트를 위쪽으로 jitter하여 사용하고,
     * 없으면 {@code jitter(delayFor(iterations - 1))}만큼 대기합니다.</p>
     *
     * @param serverHint Retry-After 값 (없으면 null)
     * @param context 호출 컨텍스트
     * @return 실제 대기한 시간
     * @throws InterruptedException 대기 중 인터럽트 발생
     * @throws CallAbortedException 취소되었거나 대기가 호출 마감을 넘기는 경우
     */
    public Duration pause(Duration serverHint, CallContext context) throws InterruptedException {
        Duration delay = nextDelay(serverHint);
        sleep(delay, context);
        return delay;
    }

    /**
     * 미리 계산한 지연만큼 대기.
     *
     * @param delay {@link #nextDelay(Duration)}로 계산한 지연
     * @param context 호출 컨텍스트
     * @throws InterruptedException 대기 중 인터럽트 발생
     * @throws CallAbortedException 취소되었거나 대기가 호출 마감을 넘기는 경우
     */
    public void sleep(Duration delay, CallContext context) throws InterruptedException {
        context.checkpoint();
        if (context.deadline().isBounded() && context.deadline().remaining().compareTo(delay) < 0) {
            throw CallAbortedException.deadlineExceeded();
        }
        sleeper.sleep(delay, context);
    }

    /**
     * 다음 대기 시간 계산 (대기하지 않음).
     */
    public Duration nextDelay(Duration serverHint) {
        if (serverHint != null) {
            return calculator.jitterHint(serverHint);
        }
        return calculator.calculate(Math.max(0, iterations - 1));
    }
}
