package com.ryuqq.relay.core.spi;

import com.ryuqq.relay.core.model.HostKey;

/**
 * 호스트별 {@link HttpTransport} 생성 SPI.
 *
 * <p>Session Pool이 캐시 미스 시에만 호출합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransportFactory {

    /**
     * 호스트 전용 Transport 생성.
     *
     * @param hostKey 대상 호스트
     * @return 새 Transport
     */
    HttpTransport create(HostKey hostKey);
}
