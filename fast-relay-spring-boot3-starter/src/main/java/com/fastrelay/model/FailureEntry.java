package com.fastrelay.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 单次失败记录 (时间, 错误分类, 第几次尝试)
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FailureEntry {

    private final Instant at;

    private final String errorClass;

    private final int attempt;

    public FailureEntry(Instant at, String errorClass, int attempt) {
        this.at = at;
        this.errorClass = errorClass;
        this.attempt = attempt;
    }
}
