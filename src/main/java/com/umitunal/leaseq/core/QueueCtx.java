package com.umitunal.leaseq.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tenant context carried on every queue call.
 *
 * <p>The tenant id is a hard partition boundary: jobs, idempotency keys and events of one
 * tenant are never visible to another. Trace/request ids and tags are for correlation only.
 * Instances are immutable; the {@code with*} methods return copies.
 */
public final class QueueCtx {
    private final String tenantId;
    private final String traceId;
    private final String requestId;
    private final Map<String, String> tags;

    private QueueCtx(String tenantId, String traceId, String requestId, Map<String, String> tags) {
        this.tenantId = tenantId;
        this.traceId = traceId;
        this.requestId = requestId;
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public static QueueCtx of(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        return new QueueCtx(tenantId, null, null, Map.of());
    }

    public QueueCtx withTraceId(String traceId) {
        return new QueueCtx(tenantId, traceId, requestId, tags);
    }

    public QueueCtx withRequestId(String requestId) {
        return new QueueCtx(tenantId, traceId, requestId, tags);
    }

    public QueueCtx withTag(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Map<String, String> copy = new LinkedHashMap<>(tags);
        copy.put(key, value);
        return new QueueCtx(tenantId, traceId, requestId, copy);
    }

    public String getTenantId() { return tenantId; }
    public String getTraceId() { return traceId; }
    public String getRequestId() { return requestId; }
    public Map<String, String> getTags() { return tags; }

    public String getTag(String key) {
        return tags.get(key);
    }

    @Override
    public String toString() {
        return String.format("QueueCtx{tenant='%s', trace='%s', request='%s', tags=%s}",
                tenantId, traceId, requestId, tags);
    }
}
