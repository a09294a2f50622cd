package com.fastrelay.core.spi.broker;

import com.fastrelay.exception.PublishException;
import com.fastrelay.model.AckHandle;
import com.fastrelay.model.Message;

/**
 * broker 抽象, 由外部实现
 * 传输层故障以 BrokerTransportException 抛出
 */
public interface Broker {

    /**
     * 投递消息, 失败抛 PublishException
     */
    void publish(String destination, Message message) throws PublishException;

    /**
     * 订阅 destination, 返回的订阅关闭后不可重开
     */
    Subscription consume(String destination);

    void ack(AckHandle handle);

    /**
     * @param requeue true 则 broker 稍后重投
     */
    void nack(AckHandle handle, boolean requeue);
}
