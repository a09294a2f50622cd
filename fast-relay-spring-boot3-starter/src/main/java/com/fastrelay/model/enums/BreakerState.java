package com.fastrelay.model.enums;

/**
 * 熔断器状态
 */
public enum BreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
