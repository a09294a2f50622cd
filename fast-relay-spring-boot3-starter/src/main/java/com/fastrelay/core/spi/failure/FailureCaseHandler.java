package com.fastrelay.core.spi.failure;

/**
 * 按异常类型给出失败分类
 * 多个 handler 都匹配时, 由 RouterFailureClassifier 选类型继承距离最近的一个
 */
public interface FailureCaseHandler<E extends Throwable> {

    Class<E> exceptionType();

    default boolean supports(Throwable t) {
        return exceptionType().isInstance(t);
    }

    FailureClassifier.Classification classify(E ex);
}
