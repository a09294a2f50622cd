package com.fastrelay.exception;

/**
 * handler 抛出的可重试失败, 携带显式错误分类
 * 错误分类用于查找纠正性的 PayloadTransformer
 */
public class MessageHandlingException extends RuntimeException {

    private final String errorClass;

    public MessageHandlingException(String errorClass, String message) {
        super(message);
        this.errorClass = errorClass;
    }

    public MessageHandlingException(String errorClass, String message, Throwable cause) {
        super(message, cause);
        this.errorClass = errorClass;
    }

    public String getErrorClass() {
        return errorClass;
    }
}
