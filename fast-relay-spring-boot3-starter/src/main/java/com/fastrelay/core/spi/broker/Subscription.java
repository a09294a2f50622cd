package com.fastrelay.core.spi.broker;

import com.fastrelay.model.Delivery;

import java.time.Duration;
import java.util.Optional;

/**
 * 惰性、无限的投递序列
 */
public interface Subscription extends AutoCloseable {

    /**
     * 最多等待 timeout, 无消息返回 empty
     */
    Optional<Delivery> poll(Duration timeout) throws InterruptedException;

    boolean isClosed();

    @Override
    void close();
}
