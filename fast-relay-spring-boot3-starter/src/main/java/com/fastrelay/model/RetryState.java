package com.fastrelay.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 消息属性上的重试状态视图
 * attempt 在逻辑消息生命周期内只增不减
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryState {

    /** 历史最多保留条数, 超出丢弃最早的 */
    public static final int MAX_HISTORY = 32;

    private static final RetryState INITIAL = new RetryState(0, null, null, List.of());

    private final int attempt;

    private final Instant firstFailureAt;

    private final String lastErrorClass;

    private final List<FailureEntry> failureHistory;

    public RetryState(int attempt, Instant firstFailureAt, String lastErrorClass, List<FailureEntry> failureHistory) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        this.attempt = attempt;
        this.firstFailureAt = firstFailureAt;
        this.lastErrorClass = lastErrorClass;
        this.failureHistory = failureHistory == null ? List.of() : List.copyOf(failureHistory);
    }

    public static RetryState initial() {
        return INITIAL;
    }

    /**
     * 普通失败: attempt + 1, 并追加历史
     */
    public RetryState nextFailure(Instant now, String errorClass) {
        return new RetryState(attempt + 1,
                firstFailureAt == null ? now : firstFailureAt,
                errorClass,
                append(new FailureEntry(now, errorClass, attempt)));
    }

    /**
     * 熔断拒绝: 不消耗 attempt, 只刷新最后错误
     */
    public RetryState rejected(Instant now, String errorClass) {
        return new RetryState(attempt,
                firstFailureAt == null ? now : firstFailureAt,
                errorClass,
                failureHistory);
    }

    /**
     * 终态失败: 进入死信前补记最后一次
     */
    public RetryState finalFailure(Instant now, String errorClass) {
        return new RetryState(attempt,
                firstFailureAt == null ? now : firstFailureAt,
                errorClass,
                append(new FailureEntry(now, errorClass, attempt)));
    }

    private List<FailureEntry> append(FailureEntry entry) {
        List<FailureEntry> next = new ArrayList<>(failureHistory);
        next.add(entry);
        while (next.size() > MAX_HISTORY) {
            next.remove(0);
        }
        return next;
    }
}
