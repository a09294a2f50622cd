package com.fastrelay.model.ctx;

import com.fastrelay.model.enums.NotifyEventType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 通知事件上下文, 创建后只读
 * 与具体事件无关的字段允许为 null
 */
@Getter
@ToString
public final class NotifyContext {

    private final NotifyEventType type;

    private final String nodeId;

    /** handler 名称, 同时是熔断 key */
    private final String handler;

    private final String destination;

    /** 死信记录 id */
    private final String recordId;

    private final Integer attempt;

    private final Integer maxRetries;

    /** MAX_RETRY / PERMANENT / CB_OPEN / DLQ_OCCUPANCY ... */
    private final String reasonCode;

    /** 已截断 */
    private final String lastError;

    private final Instant when;

    /** errorClass、occupancy、threshold 等附加字段 */
    private final Map<String, Object> attributes;

    @Builder(toBuilder = true)
    public NotifyContext(NotifyEventType type, String nodeId, String handler, String destination, String recordId,
                         Integer attempt, Integer maxRetries, String reasonCode, String lastError, Instant when,
                         Map<String, Object> attributes) {
        this.type = Objects.requireNonNull(type, "type");
        this.nodeId = nodeId;
        this.handler = handler;
        this.destination = destination;
        this.recordId = recordId;
        this.attempt = attempt;
        this.maxRetries = maxRetries;
        this.reasonCode = reasonCode;
        this.lastError = lastError;
        this.when = when == null ? Instant.now() : when;
        this.attributes = attributes == null || attributes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    /**
     * 限流/去重用的聚合 key, 同一 handler 在同一 destination 上的同类事件视为一组
     */
    public String groupKey() {
        return type + "|" + (handler == null ? "-" : handler) + "|" + (destination == null ? "-" : destination);
    }
}
