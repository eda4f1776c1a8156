/**
 * OData 컬렉션 조회(페이지네이션)와 upsert.
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.engine.odata;
