package com.fastrelay.core.failure.classifier;

import com.fastrelay.core.spi.failure.FailureCaseHandler;
import com.fastrelay.core.spi.failure.FailureClassifier;

/**
 * 未知异常, 兜底按可重试处理, 错误分类取异常类名
 */
public class UnknownCaseHandler implements FailureCaseHandler<Throwable> {
    @Override
    public Class<Throwable> exceptionType() {
        return Throwable.class;
    }

    @Override
    public FailureClassifier.Classification classify(Throwable ex) {
        return FailureClassifier.Classification.transientFailure(ex.getClass().getSimpleName());
    }
}
