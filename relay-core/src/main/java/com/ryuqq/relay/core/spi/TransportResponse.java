package com.ryuqq.relay.core.spi;

import com.ryuqq.relay.core.model.Payload;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 전송 계층이 반환하는 원시 HTTP 응답.
 *
 * <p>헤더 이름은 대소문자를 구분하지 않습니다 ({@code retry-after}와 {@code Retry-After}는 같은 헤더).</p>
 *
 * @param statusCode HTTP 상태 코드 (100~599)
 * @param headers 응답 헤더 (이름 → 값 목록)
 * @param body 응답 본문 (없으면 빈 Payload)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record TransportResponse(int statusCode, Map<String, List<String>> headers, Payload body) {

    public TransportResponse {
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be within 100..599 (current: " + statusCode + ")");
        }
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null && values != null) {
                    copy.computeIfAbsent(name, k -> new ArrayList<>()).addAll(values);
                }
            });
        }
        copy.replaceAll((name, values) -> List.copyOf(values));
        headers = Collections.unmodifiableMap(copy);
        if (body == null) {
            body = Payload.empty();
        }
    }

    /**
     * 단일 값 헤더로 응답 생성.
     *
     * @param statusCode 상태 코드
     * @param headers 헤더 (이름 → 값)
     * @param body 본문
     * @return TransportResponse
     */
    public static TransportResponse of(int statusCode, Map<String, String> headers, Payload body) {
        Map<String, List<String>> multi = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, value) -> multi.put(name, List.of(value)));
        }
        return new TransportResponse(statusCode, multi, body);
    }

    /**
     * 헤더 첫 번째 값 조회.
     *
     * @param name 헤더 이름 (대소문자 무시)
     * @return 값 (없으면 empty)
     */
    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public String toString() {
        return "TransportResponse{status=" + statusCode + ", body=" + body + "}";
    }
}
