/**
 * 보호 정책 SPI.
 *
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.protection.RateLimiter} - 호출 속도 제한 (Token Bucket)</li>
 *   <li>{@link com.ryuqq.relay.core.protection.CircuitBreaker} - 연속 실패 시 Fail-Fast</li>
 * </ul>
 *
 * <p>실제 구현은 relay-adapter-protection 모듈에 있으며,
 * 정책을 끄고 싶을 때는 {@code noop} 패키지의 구현을 사용합니다.</p>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.protection;
