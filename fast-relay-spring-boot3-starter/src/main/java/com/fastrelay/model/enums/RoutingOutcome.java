package com.fastrelay.model.enums;

/**
 * 单条消息的路由结果
 */
public enum RoutingOutcome {
    /** 处理成功, 原消息已确认 */
    ACKNOWLEDGED,

    /** 已投递到重试 destination, 原消息已确认 */
    RETRIED,

    /** 已归档死信, 原消息已确认 */
    DEAD_LETTERED,

    /** 原消息 nack 并重新入队, 等待 broker 重投 */
    REQUEUED
}
