package com.fastrelay.model;

import lombok.Getter;
import lombok.ToString;

/**
 * 一次投递 = 消息 + 确认句柄
 */
@Getter
@ToString
public final class Delivery {

    private final Message message;

    private final AckHandle handle;

    public Delivery(Message message, AckHandle handle) {
        this.message = message;
        this.handle = handle;
    }

    public String getDestination() {
        return handle.getDestination();
    }
}
