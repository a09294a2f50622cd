package com.fastrelay.exception;

/**
 * 不可重试的失败（例如负载格式错误）
 * 无论剩余重试次数多少, 直接进入死信
 */
public class PermanentMessageException extends MessageHandlingException {

    public PermanentMessageException(String errorClass, String message) {
        super(errorClass, message);
    }

    public PermanentMessageException(String errorClass, String message, Throwable cause) {
        super(errorClass, message, cause);
    }
}
