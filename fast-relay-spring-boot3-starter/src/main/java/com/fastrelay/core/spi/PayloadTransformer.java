package com.fastrelay.core.spi;

import java.util.Set;

/**
 * 重试前对负载做纠正性转换
 * 抛异常时原负载原样重试
 */
@FunctionalInterface
public interface PayloadTransformer {

    byte[] transform(byte[] payload, Throwable error) throws Exception;

    /**
     * 作为 Bean 自动注册时绑定的错误分类
     */
    default Set<String> errorClasses() {
        return Set.of();
    }
}
