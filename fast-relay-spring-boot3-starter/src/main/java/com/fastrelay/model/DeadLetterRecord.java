package com.fastrelay.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 死信归档记录
 * 创建后内容不再变化; 重放只产出带 replayedAt 的副本
 */
@Getter
@ToString
public final class DeadLetterRecord {

    private final String id;

    private final Message originalMessage;

    private final List<FailureEntry> failureHistory;

    /** 最终失败的错误分类 */
    private final String errorClass;

    /** 截断后的错误描述 */
    private final String lastError;

    private final Instant finalizedAt;

    /** 运维重放时间, 未重放为 null */
    private final Instant replayedAt;

    @Builder(toBuilder = true)
    public DeadLetterRecord(String id, Message originalMessage, List<FailureEntry> failureHistory,
                            String errorClass, String lastError, Instant finalizedAt, Instant replayedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.originalMessage = Objects.requireNonNull(originalMessage, "originalMessage");
        this.failureHistory = failureHistory == null ? List.of() : List.copyOf(failureHistory);
        this.errorClass = errorClass;
        this.lastError = lastError;
        this.finalizedAt = Objects.requireNonNull(finalizedAt, "finalizedAt");
        this.replayedAt = replayedAt;
    }

    public boolean isReplayed() {
        return replayedAt != null;
    }

    public DeadLetterRecord withReplayedAt(Instant when) {
        return toBuilder().replayedAt(when).build();
    }
}
