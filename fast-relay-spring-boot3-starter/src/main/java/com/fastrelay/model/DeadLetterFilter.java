package com.fastrelay.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * 死信查询条件, 字段为 null 表示不过滤
 */
@Getter
@Builder
public class DeadLetterFilter {

    private final String errorClass;

    private final Instant finalizedAfter;

    private final Instant finalizedBefore;

    /** true=只看已重放, false=只看未重放 */
    private final Boolean replayed;

    @Builder.Default
    private final int limit = 100;

    public static DeadLetterFilter all() {
        return DeadLetterFilter.builder().limit(Integer.MAX_VALUE).build();
    }

    public boolean matches(DeadLetterRecord r) {
        if (errorClass != null && !errorClass.equals(r.getErrorClass())) {
            return false;
        }
        if (finalizedAfter != null && r.getFinalizedAt().isBefore(finalizedAfter)) {
            return false;
        }
        if (finalizedBefore != null && !r.getFinalizedAt().isBefore(finalizedBefore)) {
            return false;
        }
        return replayed == null || replayed == r.isReplayed();
    }
}
