package com.fastrelay.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;

/**
 * 重试策略, 启动后只读, 多 worker 共享
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryPolicy {

    private final int maxRetries;

    private final Duration initialInterval;

    private final Duration maxInterval;

    private final double multiplier;

    /** 0~1, 0.2 表示 ±20% */
    private final double jitterFactor;

    /** exponential | fixed | spi:{name} */
    private final String strategy;

    @Builder
    public RetryPolicy(int maxRetries, Duration initialInterval, Duration maxInterval,
                       double multiplier, double jitterFactor, String strategy) {
        Objects.requireNonNull(initialInterval, "initialInterval");
        Objects.requireNonNull(maxInterval, "maxInterval");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (initialInterval.isZero() || initialInterval.isNegative()) {
            throw new IllegalArgumentException("initialInterval must be > 0");
        }
        if (maxInterval.compareTo(initialInterval) < 0) {
            throw new IllegalArgumentException("maxInterval must be >= initialInterval");
        }
        if (!(multiplier > 1.0)) {
            throw new IllegalArgumentException("multiplier must be > 1");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
        this.maxRetries = maxRetries;
        this.initialInterval = initialInterval;
        this.maxInterval = maxInterval;
        this.multiplier = multiplier;
        this.jitterFactor = jitterFactor;
        this.strategy = strategy == null || strategy.isBlank() ? "exponential" : strategy;
    }
}
