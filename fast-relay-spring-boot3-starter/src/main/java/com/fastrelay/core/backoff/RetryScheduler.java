package com.fastrelay.core.backoff;

import com.fastrelay.core.spi.BackoffPolicy;
import com.fastrelay.model.RetryPolicy;

import java.time.Duration;

/**
 * 计算下一次重试延迟
 * 抖动用于打散大量 worker 在同一次下游故障后的同步重试
 */
public class RetryScheduler {

    private final BackoffRegistry registry;

    public RetryScheduler(BackoffRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param attempt 从0开始, 调用方不会超过 maxRetries
     * @return 延迟, 始终落在 [0, maxInterval]
     */
    public Duration nextDelay(int attempt, RetryPolicy policy) {
        BackoffPolicy p = registry.resolve(policy.getStrategy());
        Duration d = p.nextDelay(attempt, policy);
        // 外部 SPI 策略同样受上限约束
        if (d == null || d.isNegative()) {
            return Duration.ZERO;
        }
        return d.compareTo(policy.getMaxInterval()) > 0 ? policy.getMaxInterval() : d;
    }
}
