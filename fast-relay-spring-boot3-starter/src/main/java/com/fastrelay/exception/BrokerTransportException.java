package com.fastrelay.exception;

/**
 * broker 传输层异常（连接断开等）, 向上抛给引擎, 重连由 broker 客户端负责
 */
public class BrokerTransportException extends RuntimeException {

    public BrokerTransportException(String message) {
        super(message);
    }

    public BrokerTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
