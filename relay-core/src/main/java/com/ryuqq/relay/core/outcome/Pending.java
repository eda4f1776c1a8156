package com.ryuqq.relay.core.outcome;

import com.ryuqq.relay.core.spi.TransportResponse;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * 서버가 요청을 접수했으나 아직 완료하지 않음 (202 Accepted + Location).
 *
 * @param location 폴링할 절대 URI
 * @param retryAfterHint 서버가 제시한 대기 시간 (없으면 null)
 * @param response 202 응답
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Pending(
    URI location,
    Duration retryAfterHint,
    TransportResponse response
) implements Outcome {

    public Pending {
        if (location == null || !location.isAbsolute()) {
            throw new IllegalArgumentException("location must be an absolute URI (current: " + location + ")");
        }
        if (retryAfterHint != null && retryAfterHint.isNegative()) {
            throw new IllegalArgumentException("retryAfterHint must be non-negative (current: " + retryAfterHint + ")");
        }
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfterHint);
    }
}
