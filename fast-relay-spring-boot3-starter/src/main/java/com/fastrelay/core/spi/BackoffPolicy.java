package com.fastrelay.core.spi;

import com.fastrelay.model.RetryPolicy;

import java.time.Duration;

/**
 * 回退策略（计算下一次重试延迟）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * 计算下一次重试延迟
     * @param attempt 第几次重试, 从0开始
     * @param policy  重试策略（initial/max/multiplier/jitter）
     * @return 延迟, 不超过 policy.maxInterval
     */
    Duration nextDelay(int attempt, RetryPolicy policy);
}
