package com.fastrelay.core.failure.classifier;

import com.fastrelay.core.spi.failure.FailureCaseHandler;
import com.fastrelay.core.spi.failure.FailureClassifier;

import java.util.concurrent.TimeoutException;

/**
 * 超时处理
 */
public class TimeoutCaseHandler implements FailureCaseHandler<TimeoutException> {

    public static final String TIMEOUT = "timeout";

    @Override
    public Class<TimeoutException> exceptionType() {
        return TimeoutException.class;
    }

    @Override
    public FailureClassifier.Classification classify(TimeoutException ex) {
        return FailureClassifier.Classification.transientFailure(TIMEOUT);
    }
}
