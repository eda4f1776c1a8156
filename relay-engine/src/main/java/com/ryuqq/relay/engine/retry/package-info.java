/**
 * 단일 요청의 시도/분류/재시도.
 *
 * <p>{@link com.ryuqq.relay.engine.retry.ResponseClassifier}가 응답을 Outcome으로 분류하고,
 * {@link com.ryuqq.relay.engine.retry.RetryExecutor}가 Retry인 동안 백오프하며 다시 시도합니다.
 * Circuit Breaker 기록은 이 패키지에서 하지 않습니다.</p>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.engine.retry;
