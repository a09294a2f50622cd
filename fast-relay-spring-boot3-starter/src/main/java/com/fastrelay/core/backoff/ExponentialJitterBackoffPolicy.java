package com.fastrelay.core.backoff;

import com.fastrelay.core.spi.BackoffPolicy;
import com.fastrelay.model.RetryPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 指数退避 + 乘性抖动
 * base = initial * multiplier^attempt, 截断到 max;
 * delay = base * (1 + jitter * (2U - 1)), 再截断到 [0, max]
 */
public class ExponentialJitterBackoffPolicy implements BackoffPolicy {

    /** [0,1) 均匀分布 */
    private final DoubleSupplier uniform;

    public ExponentialJitterBackoffPolicy() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    public ExponentialJitterBackoffPolicy(DoubleSupplier uniform) {
        this.uniform = uniform;
    }

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public Duration nextDelay(int attempt, RetryPolicy policy) {
        double initial = policy.getInitialInterval().toNanos();
        double max = policy.getMaxInterval().toNanos();
        double jf = policy.getJitterFactor();

        // attempt从0开始计数：0 -> initial, 1 -> initial * m ...
        double pow = Math.pow(policy.getMultiplier(), Math.max(0, attempt));
        double base = Math.min(initial * pow, max);

        double jittered = base;
        if (jf > 0) {
            jittered = base * (1 + jf * (2 * uniform.getAsDouble() - 1));
        }
        double delay = Math.max(0, Math.min(jittered, max));
        return Duration.ofNanos(Math.round(delay));
    }
}
