package com.fastrelay.core.notify;

import com.fastrelay.model.DeadLetterRecord;
import com.fastrelay.model.ctx.NotifyContext;
import com.fastrelay.model.enums.BreakerState;
import com.fastrelay.model.enums.NotifyEventType;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public final class NotifyContexts {

    private static final int MAX_ERROR_LEN = 4000;

    private NotifyContexts() {}

    /* ========== 对外入口（使用系统UTC时钟） ========== */

    public static NotifyContext ctxForDeadLetter(String nodeId, String handler, DeadLetterRecord r,
                                                 int attempt, int maxRetries, String reasonCode, Throwable e) {
        return ctxForDeadLetter(nodeId, handler, r, attempt, maxRetries, reasonCode, e, Clock.systemUTC());
    }

    public static NotifyContext ctxForReplay(String nodeId, DeadLetterRecord r, String destination) {
        return ctxForReplay(nodeId, r, destination, Clock.systemUTC());
    }

    public static NotifyContext ctxForOccupancy(String nodeId, String destination, long occupancy, long threshold) {
        return ctxForOccupancy(nodeId, destination, occupancy, threshold, Clock.systemUTC());
    }

    public static NotifyContext ctxForPublishFail(String nodeId, String handler, String destination,
                                                  int attempt, Exception e) {
        return ctxForPublishFail(nodeId, handler, destination, attempt, e, Clock.systemUTC());
    }

    public static NotifyContext ctxForCircuitTransition(String nodeId, String key, BreakerState from, BreakerState to) {
        return ctxForCircuitTransition(nodeId, key, from, to, Clock.systemUTC());
    }

    public static NotifyContext ctxForEngineError(String nodeId, String destination, Throwable e) {
        return ctxForEngineError(nodeId, destination, e, Clock.systemUTC());
    }

    /* ========== 带 Clock 的重载（方便测试） ========== */

    public static NotifyContext ctxForDeadLetter(String nodeId, String handler, DeadLetterRecord r,
                                                 int attempt, int maxRetries, String reasonCode, Throwable e,
                                                 Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("errorClass", r.getErrorClass());
        attrs.put("failures", r.getFailureHistory().size());
        attrs.put("finalizedAt", r.getFinalizedAt().toString());
        return new NotifyContext(
                NotifyEventType.DEAD_LETTER,
                nodeId,
                handler,
                null,
                r.getId(),
                attempt,
                maxRetries,
                safe(reasonCode),
                truncate(toError(e)),
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForReplay(String nodeId, DeadLetterRecord r, String destination, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("errorClass", r.getErrorClass());
        attrs.put("finalizedAt", r.getFinalizedAt().toString());
        return new NotifyContext(
                NotifyEventType.DEAD_LETTER_REPLAYED,
                nodeId,
                null,
                destination,
                r.getId(),
                0,
                null,
                "REPLAY",
                null,
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForOccupancy(String nodeId, String destination, long occupancy, long threshold,
                                                Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("occupancy", occupancy);
        attrs.put("threshold", threshold);
        return new NotifyContext(
                NotifyEventType.DLQ_OCCUPANCY_EXCEEDED,
                nodeId,
                null,
                destination,
                null,
                null,
                null,
                "DLQ_OCCUPANCY",
                null,
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForPublishFail(String nodeId, String handler, String destination,
                                                  int attempt, Exception e, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("op", "publish");
        return new NotifyContext(
                NotifyEventType.PUBLISH_FAILED,
                nodeId,
                handler,
                destination,
                null,
                attempt,
                null,
                "PUBLISH_FAILED",
                truncate(toError(e)),
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForCircuitTransition(String nodeId, String key, BreakerState from, BreakerState to,
                                                        Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("from", from.name());
        attrs.put("to", to.name());
        return new NotifyContext(
                NotifyEventType.CIRCUIT_OPENED,
                nodeId,
                key,
                null,
                null,
                null,
                null,
                "CB_" + to.name(),
                null,
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForEngineError(String nodeId, String destination, Throwable e, Clock clock) {
        return new NotifyContext(
                NotifyEventType.ENGINE_ERROR,
                nodeId,
                null,
                destination,
                null,
                null,
                null,
                "ENGINE_ERROR",
                truncate(toError(e)),
                now(clock),
                new HashMap<>()
        );
    }

    /* ========== 私有工具 ========== */

    private static Instant now(Clock clock) {
        return Instant.now(clock);
    }

    static String toError(Throwable e) {
        if (e == null) return null;
        String msg = e.getClass().getName() + ": " + (e.getMessage() == null ? "" : e.getMessage());
        // 可附加简短堆栈
        StringBuilder sb = new StringBuilder(msg);
        StackTraceElement[] stack = e.getStackTrace();
        // 只取前10行，避免过长
        int n = Math.min(stack.length, 10);
        for (int i = 0; i < n; i++) sb.append("\n  at ").append(stack[i]);
        return sb.toString();
    }

    static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }

    private static String safe(String s) {
        return s == null ? "UNKNOWN" : s;
    }
}
