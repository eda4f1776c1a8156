/**
 * 시도 하나의 분류 결과.
 *
 * <p>{@link com.ryuqq.relay.core.outcome.Outcome}은 sealed interface이며
 * Ok / Pending / Retry / Fail 네 가지로만 구성됩니다.</p>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.outcome;
