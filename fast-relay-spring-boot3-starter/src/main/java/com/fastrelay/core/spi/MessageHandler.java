package com.fastrelay.core.spi;

import com.fastrelay.model.Message;

/**
 * 业务消息处理器
 * 正常返回=成功; 抛异常=失败（进入分类/重试/死信）
 */
public interface MessageHandler {

    /** handler 名称, 同时作为熔断器的依赖 key */
    String name();

    /**
     * @param payload 当前负载（可能已被纠正性转换）
     * @param message 完整消息, 可读取业务属性
     */
    void handle(byte[] payload, Message message) throws Exception;
}
