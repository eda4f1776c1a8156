package com.ryuqq.relay.core.model;

/**
 * 엔진이 지원하는 HTTP 메서드.
 *
 * <p>각 메서드는 기본 멱등성 여부를 가지며, {@link RequestSpec}의
 * {@code idempotent} 기본값으로 사용됩니다.</p>
 *
 * <ul>
 *   <li>GET, PUT, DELETE: 멱등 (재전송해도 서버 상태가 같음)</li>
 *   <li>POST, PATCH: 비멱등 (재전송 시 중복 처리 가능)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum HttpMethod {

    GET(true),
    POST(false),
    PUT(true),
    PATCH(false),
    DELETE(true);

    private final boolean idempotent;

    HttpMethod(boolean idempotent) {
        this.idempotent = idempotent;
    }

    /**
     * 기본 멱등성 여부.
     *
     * @return 멱등 메서드이면 true
     */
    public boolean isIdempotent() {
        return idempotent;
    }
}
