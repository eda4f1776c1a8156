package com.ryuqq.relay.core.spi;

import java.io.IOException;

/**
 * 시도당 타임아웃 초과.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class TransportTimeoutException extends IOException {

    public TransportTimeoutException(String message) {
        super(message);
    }

    public TransportTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
