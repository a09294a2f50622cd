package com.fastrelay.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * broker 侧的确认句柄, 对核心不透明
 */
@Getter
@ToString
@EqualsAndHashCode
public final class AckHandle {

    /** 来源 destination */
    private final String destination;

    /** broker 分配的投递标识 */
    private final String deliveryTag;

    public AckHandle(String destination, String deliveryTag) {
        this.destination = destination;
        this.deliveryTag = deliveryTag;
    }
}
