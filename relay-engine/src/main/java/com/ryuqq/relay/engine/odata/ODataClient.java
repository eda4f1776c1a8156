package com.ryuqq.relay.engine.odata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.relay.core.exception.AuthenticationException;
import com.ryuqq.relay.core.exception.RelayException;
import com.ryuqq.relay.core.exception.RequestCancelledException;
import com.ryuqq.relay.core.model.Payload;
import com.ryuqq.relay.core.result.ErrorKind;
import com.ryuqq.relay.core.result.OperationResult;
import com.ryuqq.relay.core.time.CallContext;
import com.ryuqq.relay.core.time.Sleeper;
import com.ryuqq.relay.engine.RequestEngine;
import com.ryuqq.relay.engine.RequestOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * OData 엔드포인트용 상위 API.
 *
 * <p>모든 요청은 {@link RequestEngine}을 거치므로 인증 헤더, Rate Limit,
 * Circuit Breaker, 재시도, 202 폴링이 그대로 적용됩니다.</p>
 *
 * <p><strong>페이지네이션 ({@link #getAll}):</strong></p>
 * <pre>
 * 1. {collectionUrl}?$filter=..&amp;$select=..&amp;$top={pageSize}&amp;$skip={skip}
 * 2. value가 비었으면 종료
 * 3. @odata.nextLink가 없고 value가 pageSize보다 적으면 종료
 * 4. 가득 찬 페이지 뒤에는 pageDelay 대기 후 skip += pageSize
 * 5. maxPages 도달 시 종료
 * </pre>
 *
 * <p>첫 페이지 실패는 예외로 전파하고, 이후 페이지 실패는 그때까지 받은 엔티티를 반환합니다.
 * 인증 실패와 호출자 취소는 페이지와 관계없이 전파합니다.</p>
 *
 * <p><strong>Upsert ({@link #createOrUpdate}):</strong>
 * {@code $filter=key eq 'value'}로 조회해 있으면 PATCH (ETag가 있으면 If-Match), 없으면 POST.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ODataClient {

    private static final Logger log = LoggerFactory.getLogger(ODataClient.class);

    private static final String METADATA_PREFIX = "@odata.";
    private static final String NEXT_LINK = "@odata.nextLink";
    private static final String ENTITY_ID = "@odata.id";
    private static final String ETAG = "@odata.etag";

    private final RequestEngine engine;
    private final ObjectMapper mapper;
    private final Sleeper sleeper;

    public ODataClient(RequestEngine engine) {
        this(engine, new ObjectMapper(), Sleeper.system());
    }

    /**
     * JSON 매퍼와 대기 구현 주입 생성자.
     *
     * @param engine 요청 엔진
     * @param mapper JSON 매퍼
     * @param sleeper 페이지 간 대기 구현
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ODataClient(RequestEngine engine, ObjectMapper mapper, Sleeper sleeper) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.engine = engine;
        this.mapper = mapper;
        this.sleeper = sleeper;
    }

    // ============================================================
    // 페이지네이션 조회
    // ============================================================

    /**
     * 컬렉션 전체 조회.
     *
     * @param collectionUrl 엔티티 컬렉션 URL (예: https://org.example.com/api/data/v9.2/accounts)
     * @param query 조회 조건
     * @return {@code @odata.*} 메타데이터를 제거한 엔티티 목록
     * @throws RelayException 첫 페이지 실패, 인증 실패 또는 취소
     */
    public List<ObjectNode> getAll(String collectionUrl, ODataQuery query) {
        if (collectionUrl == null || collectionUrl.isBlank()) {
            throw new IllegalArgumentException("collectionUrl cannot be null or blank");
        }
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        String context = URI.create(collectionUrl).getHost();
        log.info("[{}] Starting paginated fetch of {}", context, collectionUrl);
        if (query.filter() != null) {
            log.debug("[{}] Filter: {}", context, query.filter());
        }

        List<ObjectNode> entities = new ArrayList<>();
        int skip = 0;
        int page = 1;
        int fetched = 0;
        while (true) {
            if (query.hasPageLimit() && page > query.maxPages()) {
                log.info("[{}] Reached max pages limit ({})", context, query.maxPages());
                break;
            }

            String url = pageUrl(collectionUrl, query, skip);
            JsonNode body;
            try {
                log.debug("[{}] Fetching page {} (skip={}, top={})", context, page, skip, query.pageSize());
                body = readJson(engine.get(url), url);
            } catch (AuthenticationException | RequestCancelledException e) {
                throw e;
            } catch (RelayException e) {
                log.error("[{}] Failed to fetch page {}: {}", context, page, e.getMessage());
                if (page == 1) {
                    throw e;
                }
                log.warn("[{}] Continuing with {} entities from successful pages", context, entities.size());
                break;
            }
            fetched++;

            JsonNode values = body.path("value");
            if (!values.isArray() || values.isEmpty()) {
                log.info("[{}] No more entities found, pagination complete", context);
                break;
            }
            for (JsonNode value : values) {
                if (value instanceof ObjectNode entity) {
                    entities.add(stripMetadata(entity));
                }
            }
            log.debug("[{}] Page {}: Retrieved {} entities (total: {})", context, page, values.size(), entities.size());

            if (!body.hasNonNull(NEXT_LINK) && values.size() < query.pageSize()) {
                log.debug("[{}] Last page reached (got {} < {})", context, values.size(), query.pageSize());
                break;
            }
            skip += query.pageSize();
            page++;

            if (values.size() == query.pageSize() && !pause(query.pageDelay(), context)) {
                break;
            }
        }

        log.info("[{}] Retrieved total of {} entities across {} pages", context, entities.size(), fetched);
        return entities;
    }

    // ============================================================
    // Upsert
    // ============================================================

    /**
     * 키 필드로 조회해 있으면 갱신, 없으면 생성.
     *
     * @param collectionUrl 엔티티 컬렉션 URL
     * @param keyField 식별 필드명
     * @param keyValue 식별 값
     * @param payload 생성/갱신할 내용
     * @return 처리 결과 (실패도 예외 대신 FAILED 결과로 반환)
     */
    public UpsertResult createOrUpdate(String collectionUrl, String keyField, String keyValue, JsonNode payload) {
        if (collectionUrl == null || collectionUrl.isBlank()) {
            throw new IllegalArgumentException("collectionUrl cannot be null or blank");
        }
        if (keyField == null || keyField.isBlank()) {
            throw new IllegalArgumentException("keyField cannot be null or blank");
        }
        if (keyValue == null) {
            throw new IllegalArgumentException("keyValue cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        String context = URI.create(collectionUrl).getHost();
        Payload body = serialize(payload);

        try {
            String filter = keyField + " eq '" + keyValue.replace("'", "''") + "'";
            String lookupUrl = collectionUrl + separator(collectionUrl) + "$filter=" + encode(filter);
            log.debug("[{}] Checking for existing entity with {}='{}'", context, keyField, keyValue);
            JsonNode values = readJson(engine.get(lookupUrl), lookupUrl).path("value");

            if (values.isArray() && !values.isEmpty()) {
                JsonNode existing = values.get(0);
                String updateUrl = existing.hasNonNull(ENTITY_ID)
                    ? existing.get(ENTITY_ID).asText()
                    : collectionUrl + "(" + (existing.hasNonNull("id") ? existing.get("id").asText() : keyValue) + ")";
                RequestOptions options = existing.hasNonNull(ETAG)
                    ? RequestOptions.defaults().withIfMatch(existing.get(ETAG).asText())
                    : RequestOptions.defaults();

                log.debug("[{}] Updating existing entity {}", context, keyValue);
                OperationResult updated = engine.patch(updateUrl, body, options);
                return UpsertResult.updated(keyValue, updated.statusCode(), updated.payload());
            }

            log.debug("[{}] Creating new entity {}", context, keyValue);
            OperationResult created = engine.post(collectionUrl, body);
            return UpsertResult.created(keyValue, created.statusCode(), created.payload());
        } catch (RelayException e) {
            log.error("[{}] Failed to create/update {}: {}", context, keyValue, e.getMessage());
            return UpsertResult.failed(keyValue, e.getStatusCode(), e.getErrorKind(), e.getMessage());
        }
    }

    // ============================================================
    // 내부
    // ============================================================

    private static String pageUrl(String collectionUrl, ODataQuery query, int skip) {
        StringBuilder url = new StringBuilder(collectionUrl).append(separator(collectionUrl));
        if (query.filter() != null) {
            url.append("$filter=").append(encode(query.filter())).append('&');
        }
        if (!query.select().isEmpty()) {
            url.append("$select=").append(String.join(",", query.select())).append('&');
        }
        return url.append("$top=").append(query.pageSize())
            .append("&$skip=").append(skip)
            .toString();
    }

    private static String separator(String url) {
        return url.indexOf('?') >= 0 ? "&" : "?";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private JsonNode readJson(OperationResult result, String url) {
        if (result.payload() == null || result.payload().isEmpty()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(result.payload().bytes());
        } catch (IOException e) {
            throw RelayException.from(OperationResult.failure(
                ErrorKind.OPERATION,
                "invalid JSON in response from " + url + ": " + e.getMessage(),
                result.statusCode(),
                result.payload(),
                result.attempts(),
                result.polls(),
                result.totalElapsed()));
        }
    }

    private Payload serialize(JsonNode payload) {
        try {
            return Payload.of(mapper.writeValueAsBytes(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload cannot be serialized to JSON", e);
        }
    }

    private static ObjectNode stripMetadata(ObjectNode entity) {
        List<String> metadata = new ArrayList<>();
        entity.fieldNames().forEachRemaining(name -> {
            if (name.startsWith(METADATA_PREFIX)) {
                metadata.add(name);
            }
        });
        ObjectNode cleaned = entity.deepCopy();
        cleaned.remove(metadata);
        return cleaned;
    }

    // 인터럽트되면 false (남은 페이지는 건너뜀)
    private boolean pause(Duration delay, String context) {
        if (delay.isZero()) {
            return true;
        }
        log.debug("[{}] Sleeping {}ms between pages", context, delay.toMillis());
        try {
            sleeper.sleep(delay, CallContext.none());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted between pages, returning entities fetched so far", context);
            return false;
        }
    }
}
