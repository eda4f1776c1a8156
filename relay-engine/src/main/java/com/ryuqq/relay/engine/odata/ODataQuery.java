package com.ryuqq.relay.engine.odata;

import java.time.Duration;
import java.util.List;

/**
 * 컬렉션 조회 조건.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ODataQuery query = ODataQuery.all()
 *     .withFilter("statecode eq 0")
 *     .withSelect(List.of("accountid", "name"))
 *     .withPageSize(500)
 *     .withMaxPages(10);
 * }</pre>
 *
 * @param filter $filter 식 (없으면 null)
 * @param select $select 필드 목록
 * @param pageSize 페이지당 건수 ($top, 최대 1000으로 제한)
 * @param maxPages 최대 페이지 수 (0이면 무제한)
 * @param pageDelay 가득 찬 페이지 다음 요청 전 대기 시간
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record ODataQuery(
    String filter,
    List<String> select,
    int pageSize,
    int maxPages,
    Duration pageDelay
) {

    public static final int MAX_PAGE_SIZE = 1000;

    private static final ODataQuery ALL = new ODataQuery(null, List.of(), 100, 0, Duration.ofMillis(500));

    public ODataQuery {
        if (filter != null && filter.isBlank()) {
            filter = null;
        }
        select = select == null ? List.of() : List.copyOf(select);
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive (current: " + pageSize + ")");
        }
        pageSize = Math.min(pageSize, MAX_PAGE_SIZE);
        if (maxPages < 0) {
            throw new IllegalArgumentException("maxPages must be non-negative (current: " + maxPages + ")");
        }
        if (pageDelay == null || pageDelay.isNegative()) {
            throw new IllegalArgumentException("pageDelay cannot be null or negative");
        }
    }

    /**
     * 조건 없는 전체 조회 (100건씩, 페이지 제한 없음, 500ms 간격).
     */
    public static ODataQuery all() {
        return ALL;
    }

    public ODataQuery withFilter(String filter) {
        return new ODataQuery(filter, select, pageSize, maxPages, pageDelay);
    }

    public ODataQuery withSelect(List<String> select) {
        return new ODataQuery(filter, select, pageSize, maxPages, pageDelay);
    }

    public ODataQuery withPageSize(int pageSize) {
        return new ODataQuery(filter, select, pageSize, maxPages, pageDelay);
    }

    public ODataQuery withMaxPages(int maxPages) {
        return new ODataQuery(filter, select, pageSize, maxPages, pageDelay);
    }

    public ODataQuery withPageDelay(Duration pageDelay) {
        return new ODataQuery(filter, select, pageSize, maxPages, pageDelay);
    }

    public boolean hasPageLimit() {
        return maxPages > 0;
    }
}
