package com.fastrelay.core.failure.classifier;

import com.fastrelay.core.spi.failure.FailureCaseHandler;
import com.fastrelay.core.spi.failure.FailureClassifier;
import com.fastrelay.exception.PermanentMessageException;

/**
 * 不可重试, 直接死信
 */
public class PermanentCaseHandler implements FailureCaseHandler<PermanentMessageException> {
    @Override
    public Class<PermanentMessageException> exceptionType() {
        return PermanentMessageException.class;
    }

    @Override
    public FailureClassifier.Classification classify(PermanentMessageException ex) {
        return FailureClassifier.Classification.permanent(errorClassOf(ex));
    }

    static String errorClassOf(com.fastrelay.exception.MessageHandlingException ex) {
        String ec = ex.getErrorClass();
        return ec == null || ec.isBlank() ? ex.getClass().getSimpleName() : ec;
    }
}
