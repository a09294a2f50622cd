package com.fastrelay.core.backoff;

import com.fastrelay.core.spi.BackoffPolicy;
import com.fastrelay.model.RetryPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 固定间隔策略（可选小幅抖动）
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    private final DoubleSupplier uniform;

    public FixedBackoffPolicy() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    public FixedBackoffPolicy(DoubleSupplier uniform) {
        this.uniform = uniform;
    }

    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public Duration nextDelay(int attempt, RetryPolicy policy) {
        double delay = policy.getInitialInterval().toNanos();
        double max = policy.getMaxInterval().toNanos();
        double jf = policy.getJitterFactor();

        if (jf > 0) {
            delay = delay * (1 + jf * (2 * uniform.getAsDouble() - 1));
        }
        delay = Math.max(0, Math.min(delay, max));
        return Duration.ofNanos(Math.round(delay));
    }
}
