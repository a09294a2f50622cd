package com.fastrelay.core.failure.classifier;

import com.fastrelay.core.spi.failure.FailureCaseHandler;
import com.fastrelay.core.spi.failure.FailureClassifier;
import com.fastrelay.exception.MessageHandlingException;

/**
 * handler 显式给出错误分类的可重试失败
 */
public class ClassifiedCaseHandler implements FailureCaseHandler<MessageHandlingException> {
    @Override
    public Class<MessageHandlingException> exceptionType() {
        return MessageHandlingException.class;
    }

    @Override
    public FailureClassifier.Classification classify(MessageHandlingException ex) {
        return FailureClassifier.Classification.transientFailure(PermanentCaseHandler.errorClassOf(ex));
    }
}
