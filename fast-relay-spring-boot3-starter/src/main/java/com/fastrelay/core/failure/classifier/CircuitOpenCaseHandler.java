package com.fastrelay.core.failure.classifier;

import com.fastrelay.core.spi.failure.FailureCaseHandler;
import com.fastrelay.core.spi.failure.FailureClassifier;
import com.fastrelay.exception.CircuitOpenException;

/**
 * 熔断快速失败, 不消耗重试次数
 */
public class CircuitOpenCaseHandler implements FailureCaseHandler<CircuitOpenException> {
    @Override
    public Class<CircuitOpenException> exceptionType() {
        return CircuitOpenException.class;
    }

    @Override
    public FailureClassifier.Classification classify(CircuitOpenException ex) {
        return FailureClassifier.Classification.circuitOpen();
    }
}
