package com.fastrelay.model.enums;

/**
 * 通知事件
 */
public enum NotifyEventType {
    /** 进入死信 */
    DEAD_LETTER,

    /** 死信被重放 */
    DEAD_LETTER_REPLAYED,

    /** 死信堆积超过阈值 */
    DLQ_OCCUPANCY_EXCEEDED,

    /** 投递重试/死信 destination 失败 */
    PUBLISH_FAILED,

    /** 熔断打开 */
    CIRCUIT_OPENED,

    /** 引擎级异常（broker 连接、线程池拒绝等） */
    ENGINE_ERROR
}
