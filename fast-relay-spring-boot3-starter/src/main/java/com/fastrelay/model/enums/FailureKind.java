package com.fastrelay.model.enums;

/**
 * 失败分类
 */
public enum FailureKind {
    /** 可重试 */
    TRANSIENT,

    /** 不可重试, 直接死信 */
    PERMANENT,

    /** 熔断拒绝, 不消耗重试次数 */
    CIRCUIT_OPEN
}
