/**
 * 백오프 계산과 대기 루프.
 *
 * <ul>
 *   <li>{@link com.ryuqq.relay.engine.backoff.BackoffCalculator}: 지수 증가 + 상한 + jitter</li>
 *   <li>{@link com.ryuqq.relay.engine.backoff.BackoffBudget}: 시도 횟수 또는 경과 시간 한도</li>
 *   <li>{@link com.ryuqq.relay.engine.backoff.BackoffLoop}: 재시도와 폴링이 공유하는 대기 루프</li>
 *   <li>{@link com.ryuqq.relay.engine.backoff.RetryAfter}: Retry-After 헤더 해석</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.engine.backoff;
