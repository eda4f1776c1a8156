package com.ryuqq.relay.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 단일 논리 호출의 불변 입력.
 *
 * <p>재시도와 폴링 전체에 걸쳐 동일한 RequestSpec이 사용됩니다.
 * {@code idempotent}는 네트워크 오류/5xx 발생 시 재전송 허용 여부를 결정합니다.</p>
 *
 * @param method HTTP 메서드
 * @param url 절대 URL
 * @param headers 요청 헤더 (수정 불가 사본으로 보관)
 * @param body 요청 본문 (null이면 빈 Payload)
 * @param idempotent 재전송 안전 여부
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record RequestSpec(
    HttpMethod method,
    URI url,
    Map<String, String> headers,
    Payload body,
    boolean idempotent
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException method, url이 null이거나 url이 절대 경로가 아닌 경우
     */
    public RequestSpec {
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        if (url == null) {
            throw new IllegalArgumentException("url cannot be null");
        }
        if (!url.isAbsolute() || url.getHost() == null) {
            throw new IllegalArgumentException("url must be absolute (current: " + url + ")");
        }
        headers = headers == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        if (body == null) {
            body = Payload.empty();
        }
    }

    /**
     * 메서드 기본 멱등성으로 RequestSpec 생성 (본문/헤더 없음).
     *
     * @param method HTTP 메서드
     * @param url 절대 URL
     * @return RequestSpec 인스턴스
     */
    public static RequestSpec of(HttpMethod method, URI url) {
        if (method == null) {
            throw new IllegalArgumentException("method cannot be null");
        }
        return new RequestSpec(method, url, Map.of(), Payload.empty(), method.isIdempotent());
    }

    /**
     * 세션 풀 키.
     *
     * @return url의 HostKey
     */
    public HostKey hostKey() {
        return HostKey.of(url);
    }

    public RequestSpec withHeaders(Map<String, String> headers) {
        return new RequestSpec(method, url, headers, body, idempotent);
    }

    public RequestSpec withBody(Payload body) {
        return new RequestSpec(method, url, headers, body, idempotent);
    }

    public RequestSpec withIdempotent(boolean idempotent) {
        return new RequestSpec(method, url, headers, body, idempotent);
    }

    @Override
    public String toString() {
        return "RequestSpec{" + method + " " + url + ", idempotent=" + idempotent + ", body=" + body + '}';
    }
}
