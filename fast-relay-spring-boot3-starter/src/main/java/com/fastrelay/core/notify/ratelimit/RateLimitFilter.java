package com.fastrelay.core.notify.ratelimit;

import com.fastrelay.core.spi.notify.NotifierFilter;
import com.fastrelay.model.ctx.NotifyContext;
import com.fastrelay.model.enums.Severity;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * 按事件分组的固定窗口限流
 * 同一 handler 在同一 destination 上反复死信时, 每个窗口最多放行 perGroup 条
 * CRITICAL 事件不限流
 */
public class RateLimitFilter implements NotifierFilter {

    private final long windowMs;

    private final int perGroup;

    private final LongSupplier clock;

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();

    public RateLimitFilter(Duration window, int perGroup) {
        this(window, perGroup, System::currentTimeMillis);
    }

    public RateLimitFilter(Duration window, int perGroup, LongSupplier clock) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("rate limit window must be > 0");
        }
        this.windowMs = window.toMillis();
        this.perGroup = perGroup;
        this.clock = clock;
    }

    @Override
    public boolean allow(NotifyContext ctx, Severity sev) {
        if (sev == Severity.CRITICAL) {
            return true;
        }
        long now = clock.getAsLong();
        int[] seen = new int[1];
        windows.compute(ctx.groupKey(), (k, cur) -> {
            Window w = cur == null || now - cur.start >= windowMs ? new Window(now) : cur;
            seen[0] = ++w.count;
            return w;
        });
        return seen[0] <= perGroup;
    }

    /** 过期窗口清理, 由调用方按需触发 */
    public void evictExpired() {
        long now = clock.getAsLong();
        windows.entrySet().removeIf(e -> now - e.getValue().start >= windowMs);
    }

    int groups() {
        return windows.size();
    }

    private static final class Window {
        private final long start;
        private int count;

        private Window(long start) {
            this.start = start;
        }
    }
}
