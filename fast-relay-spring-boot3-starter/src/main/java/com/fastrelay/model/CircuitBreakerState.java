package com.fastrelay.model;

import com.fastrelay.model.enums.BreakerState;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * 单个依赖 key 的熔断器快照, 只读
 */
@Getter
@Builder
@ToString
public class CircuitBreakerState {

    private final String key;

    private final BreakerState state;

    private final int consecutiveFailures;

    private final Instant lastFailureAt;

    private final int failureThreshold;

    private final Duration resetTimeout;
}
