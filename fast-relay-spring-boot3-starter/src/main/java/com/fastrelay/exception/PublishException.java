package com.fastrelay.exception;

/**
 * 投递到 destination 失败
 * 调用方不得确认原消息, 必须 nack 让 broker 重投
 */
public class PublishException extends Exception {

    private final String destination;

    public PublishException(String destination, String message) {
        super(message);
        this.destination = destination;
    }

    public PublishException(String destination, String message, Throwable cause) {
        super(message, cause);
        this.destination = destination;
    }

    public String getDestination() {
        return destination;
    }
}
