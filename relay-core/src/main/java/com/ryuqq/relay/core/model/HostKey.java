package com.ryuqq.relay.core.model;

import java.net.URI;
import java.util.Locale;

/**
 * 세션 풀의 캐시 키 (scheme + host + port).
 *
 * <p>같은 HostKey를 가진 요청은 하나의 전송 세션(커넥션)을 공유합니다.</p>
 *
 * <p><strong>정규화 규칙:</strong></p>
 * <ul>
 *   <li>scheme, host는 소문자로 변환</li>
 *   <li>포트가 생략된 경우 http=80, https=443</li>
 *   <li>path, query는 키에 포함하지 않음</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class HostKey {

    private final String scheme;
    private final String host;
    private final int port;

    private HostKey(String scheme, String host, int port) {
        this.scheme = scheme;
        this.host = host;
        this.port = port;
    }

    /**
     * URI로부터 HostKey 생성.
     *
     * @param uri 절대 URI
     * @return HostKey 인스턴스
     * @throws IllegalArgumentException uri가 null이거나 scheme/host가 없는 경우
     */
    public static HostKey of(URI uri) {
        if (uri == null) {
            throw new IllegalArgumentException("uri cannot be null");
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("uri must be absolute with a host (current: " + uri + ")");
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        int port = uri.getPort() != -1 ? uri.getPort() : defaultPort(scheme);
        return new HostKey(scheme, uri.getHost().toLowerCase(Locale.ROOT), port);
    }

    private static int defaultPort(String scheme) {
        return switch (scheme) {
            case "http" -> 80;
            case "https" -> 443;
            default -> -1;
        };
    }

    public String getScheme() {
        return scheme;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /**
     * 정규화된 키 값 조회.
     *
     * @return 예: {@code https://api.example.com:443}
     */
    public String getValue() {
        return scheme + "://" + host + ":" + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HostKey hostKey = (HostKey) o;
        return port == hostKey.port && scheme.equals(hostKey.scheme) && host.equals(hostKey.host);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * scheme.hashCode() + host.hashCode()) + port;
    }

    @Override
    public String toString() {
        return "HostKey{" + getValue() + '}';
    }
}
