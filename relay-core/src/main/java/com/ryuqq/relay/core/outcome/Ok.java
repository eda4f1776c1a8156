package com.ryuqq.relay.core.outcome;

import com.ryuqq.relay.core.spi.TransportResponse;

/**
 * 성공 응답.
 *
 * @param response 최종 응답
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Ok(TransportResponse response) implements Outcome {

    public Ok {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
    }
}
