/**
 * 202 Accepted 비동기 작업 폴링.
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.engine.poll;
