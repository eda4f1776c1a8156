/**
 * 요청 모델 (HttpMethod, HostKey, Payload, RequestSpec).
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.model;
