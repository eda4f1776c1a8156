package com.ryuqq.relay.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 요청/응답 본문.
 *
 * <p>원본 바이트를 그대로 보관하며, 필요 시 UTF-8 문자열로 디코딩합니다.
 * JSON 등의 역직렬화는 호출자의 책임입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>JSON: Payload.of("{\"ok\":true}")</li>
 *   <li>바이너리: Payload.of(bytes)</li>
 *   <li>빈 Payload: Payload.empty()</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 시와 조회 시 모두 방어적 복사</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(new byte[0]);

    private final byte[] value;

    private Payload(byte[] value) {
        this.value = value;
    }

    /**
     * UTF-8 문자열로 Payload 생성.
     *
     * @param value 본문 문자열 (null이면 빈 Payload)
     * @return Payload 인스턴스
     */
    public static Payload of(String value) {
        if (value == null || value.isEmpty()) {
            return EMPTY;
        }
        return new Payload(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 바이트 배열로 Payload 생성.
     *
     * @param value 본문 바이트 (null이면 빈 Payload)
     * @return Payload 인스턴스
     */
    public static Payload of(byte[] value) {
        if (value == null || value.length == 0) {
            return EMPTY;
        }
        return new Payload(value.clone());
    }

    /**
     * 빈 Payload.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * 원본 바이트 조회 (복사본).
     *
     * @return 본문 바이트
     */
    public byte[] bytes() {
        return value.clone();
    }

    /**
     * UTF-8 문자열로 디코딩.
     *
     * @return 본문 문자열 (빈 Payload는 빈 문자열)
     */
    public String asString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    public int size() {
        return value.length;
    }

    public boolean isEmpty() {
        return value.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(value, ((Payload) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "Payload{" + value.length + " bytes}";
    }
}
