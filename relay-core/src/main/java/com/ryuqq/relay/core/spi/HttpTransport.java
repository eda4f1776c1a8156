package com.ryuqq.relay.core.spi;

import com.ryuqq.relay.core.model.RequestSpec;
import com.ryuqq.relay.core.time.CancellationToken;

import java.io.IOException;
import java.time.Duration;

/**
 * 단일 호스트에 대한 HTTP 전송 SPI.
 *
 * <p>하나의 인스턴스는 하나의 {@link com.ryuqq.relay.core.model.HostKey}에 묶이며,
 * 커넥션 재사용은 구현체의 책임입니다. Session Pool이 인스턴스의 수명을 관리합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>여러 스레드에서 동시에 {@link #send}를 호출할 수 있어야 합니다.</li>
 *   <li>timeout을 넘기면 {@link TransportTimeoutException}을 던집니다.</li>
 *   <li>취소 토큰이 취소되면 진행 중인 요청을 중단하고
 *       {@link java.util.concurrent.CancellationException}을 던집니다.</li>
 *   <li>HTTP 상태 코드는 해석하지 않고 그대로 반환합니다 (4xx/5xx도 정상 반환).</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface HttpTransport extends AutoCloseable {

    /**
     * 요청 한 건 전송.
     *
     * @param request 요청
     * @param timeout 시도당 타임아웃
     * @param cancellation 호출자 취소 신호
     * @return 원시 응답
     * @throws IOException 네트워크 오류 (타임아웃이면 {@link TransportTimeoutException})
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    TransportResponse send(RequestSpec request, Duration timeout, CancellationToken cancellation)
        throws IOException, InterruptedException;

    /**
     * 커넥션 자원 해제. 여러 번 호출해도 안전해야 합니다.
     */
    @Override
    void close();
}
