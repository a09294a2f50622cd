package com.fastrelay.core.tracker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fastrelay.model.FailureEntry;
import com.fastrelay.model.Message;
import com.fastrelay.model.RetryPolicy;
import com.fastrelay.model.RetryState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 在消息属性上读写重试元数据
 * 纯函数, 不依赖任何 broker 实现
 */
@Slf4j
public class DeliveryTracker {

    private final ObjectMapper mapper;

    public DeliveryTracker() {
        this(new ObjectMapper());
    }

    public DeliveryTracker(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 读取重试状态, 属性缺失或无法解析时取默认值, 从不失败
     */
    public RetryState read(Message message) {
        int attempt = parseAttempt(message.getAttribute(RetryHeaders.RETRY_COUNT));
        Instant firstFailureAt = parseInstant(message.getAttribute(RetryHeaders.FIRST_FAILURE_AT));
        String lastErrorClass = message.getAttribute(RetryHeaders.LAST_ERROR_CLASS);
        List<FailureEntry> history = parseHistory(message.getAttribute(RetryHeaders.FAILURE_HISTORY));
        return new RetryState(attempt, firstFailureAt, lastErrorClass, history);
    }

    /**
     * 返回写入重试状态后的新消息, 无关属性原样保留
     */
    public Message stamp(Message message, RetryState state) {
        List<String> removals = new ArrayList<>();
        Map<String, String> updates = new LinkedHashMap<>();
        updates.put(RetryHeaders.RETRY_COUNT, Integer.toString(state.getAttempt()));
        if (state.getFirstFailureAt() != null) {
            updates.put(RetryHeaders.FIRST_FAILURE_AT, state.getFirstFailureAt().toString());
        } else {
            removals.add(RetryHeaders.FIRST_FAILURE_AT);
        }
        if (state.getLastErrorClass() != null) {
            updates.put(RetryHeaders.LAST_ERROR_CLASS, state.getLastErrorClass());
        } else {
            removals.add(RetryHeaders.LAST_ERROR_CLASS);
        }
        if (!state.getFailureHistory().isEmpty()) {
            updates.put(RetryHeaders.FAILURE_HISTORY, writeHistory(state.getFailureHistory()));
        } else {
            removals.add(RetryHeaders.FAILURE_HISTORY);
        }
        return message.withoutAttributes(removals).withAttributes(updates);
    }

    /**
     * 记录期望延迟
     */
    public Message withDelay(Message message, Duration delay) {
        return message.withAttribute(RetryHeaders.RETRY_DELAY_MS, Long.toString(delay.toMillis()));
    }

    /**
     * 清除全部核心属性, 相当于 attempt 归零
     */
    public Message clear(Message message) {
        return message.withoutAttributes(RetryHeaders.CORE_OWNED);
    }

    /**
     * 读取期望延迟, 缺失返回 0
     */
    public static Duration delayOf(Message message) {
        String v = message.getAttribute(RetryHeaders.RETRY_DELAY_MS);
        if (v == null) {
            return Duration.ZERO;
        }
        try {
            return Duration.ofMillis(Math.max(0, Long.parseLong(v.trim())));
        } catch (NumberFormatException e) {
            return Duration.ZERO;
        }
    }

    /**
     * 是否已到终态: attempt 达到上限后不得再进入重试 destination
     */
    public static boolean exhausted(RetryState state, RetryPolicy policy) {
        return state.getAttempt() >= policy.getMaxRetries();
    }

    private static int parseAttempt(String v) {
        if (v == null) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(v.trim()));
        } catch (NumberFormatException e) {
            log.debug("[Relay-Tracker] unparseable {}={}, default to 0", RetryHeaders.RETRY_COUNT, v);
            return 0;
        }
    }

    private static Instant parseInstant(String v) {
        if (v == null) {
            return null;
        }
        try {
            return Instant.parse(v.trim());
        } catch (DateTimeParseException e) {
            log.debug("[Relay-Tracker] unparseable {}={}", RetryHeaders.FIRST_FAILURE_AT, v);
            return null;
        }
    }

    private List<FailureEntry> parseHistory(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            JsonNode root = mapper.readTree(json);
            if (!root.isArray()) {
                return List.of();
            }
            List<FailureEntry> out = new ArrayList<>(root.size());
            for (JsonNode n : root) {
                Instant at = parseInstant(n.path("at").asText(null));
                if (at == null) {
                    continue;
                }
                out.add(new FailureEntry(at, n.path("errorClass").asText(null), n.path("attempt").asInt(0)));
            }
            return out;
        } catch (JsonProcessingException e) {
            log.debug("[Relay-Tracker] unparseable {}, ignored", RetryHeaders.FAILURE_HISTORY);
            return List.of();
        }
    }

    private String writeHistory(List<FailureEntry> history) {
        ArrayNode arr = mapper.createArrayNode();
        for (FailureEntry e : history) {
            ObjectNode n = arr.addObject();
            n.put("at", e.getAt().toString());
            n.put("errorClass", e.getErrorClass());
            n.put("attempt", e.getAttempt());
        }
        try {
            return mapper.writeValueAsString(arr);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize failure history", e);
        }
    }
}
