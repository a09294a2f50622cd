package com.fastrelay.exception;

/**
 * 熔断打开时的快速失败
 * 用于 FailureClassifier 识别 依赖级故障, 不消耗消息的重试次数
 */
public class CircuitOpenException extends RuntimeException {

    private final String key;

    public CircuitOpenException(String key, Throwable cause) {
        super("circuit open for dependency '" + key + "'", cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
