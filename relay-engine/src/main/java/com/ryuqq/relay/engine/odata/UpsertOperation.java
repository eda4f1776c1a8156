package com.ryuqq.relay.engine.odata;

/**
 * upsert 처리 결과 종류.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum UpsertOperation {

    /** 기존 엔티티가 없어 POST로 생성 */
    CREATED,

    /** 키가 일치하는 엔티티를 PATCH로 갱신 */
    UPDATED,

    /** 조회/생성/갱신 중 실패 */
    FAILED
}
