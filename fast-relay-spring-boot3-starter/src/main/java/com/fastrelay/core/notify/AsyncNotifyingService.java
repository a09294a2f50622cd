package com.fastrelay.core.notify;

import com.fastrelay.core.metric.RelayMetrics;
import com.fastrelay.core.spi.notify.Notifier;
import com.fastrelay.core.spi.notify.NotifierFilter;
import com.fastrelay.core.spi.notify.NotifierRouter;
import com.fastrelay.model.ctx.NotifyContext;
import com.fastrelay.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 告警异步派发
 * 过滤链在调用线程执行, 路由与投递在通知线程池执行, 不阻塞消费 worker
 */
public class AsyncNotifyingService {

    private static final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    private final ExecutorService exec;

    private final NotifierRouter router;

    private final List<NotifierFilter> filters;

    private final RelayMetrics metrics;

    private final int maxAttempts;

    private final long initialBackoffMs;

    private final long maxBackoffMs;

    public AsyncNotifyingService(ExecutorService exec, NotifierRouter router, List<NotifierFilter> filters,
                                 RelayMetrics metrics, int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        this.exec = exec;
        this.router = router;
        this.filters = filters == null ? List.of() : List.copyOf(filters);
        this.metrics = metrics;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0, initialBackoff.toMillis());
        this.maxBackoffMs = Math.max(initialBackoffMs, maxBackoff.toMillis());
    }

    public AsyncNotifyingService(ExecutorService exec, NotifierRouter router, List<NotifierFilter> filters,
                                 RelayMetrics metrics) {
        this(exec, router, filters, metrics, 3, Duration.ofMillis(200), Duration.ofSeconds(4));
    }

    public void fire(NotifyContext ctx, Severity sev) {
        for (NotifierFilter f : filters) {
            if (!f.allow(ctx, sev)) {
                metrics.incNotifySuppressed();
                return;
            }
        }
        try {
            exec.execute(() -> dispatch(ctx, sev));
        } catch (RejectedExecutionException e) {
            // 关闭阶段的事件只记日志
            metrics.incNotifyFailed();
            log.warn("[Relay-Notify] event={} dropped, notifier pool unavailable", ctx.getType());
        }
    }

    private void dispatch(NotifyContext ctx, Severity sev) {
        for (Notifier n : router.route(ctx, sev)) {
            if (!n.supports(ctx)) {
                continue;
            }
            try {
                deliver(n, ctx, sev);
                metrics.incNotifySent();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                metrics.incNotifyFailed();
                return;
            } catch (RuntimeException e) {
                metrics.incNotifyFailed();
                log.error("[Relay-Notify] channel={} event={} handler={} failed after {} attempts",
                        n.name(), ctx.getType(), ctx.getHandler(), maxAttempts, e);
            }
        }
    }

    private void deliver(Notifier n, NotifyContext ctx, Severity sev) throws InterruptedException {
        long backoff = initialBackoffMs;
        for (int attempt = 1; ; attempt++) {
            try {
                n.notify(ctx, sev);
                return;
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.debug("[Relay-Notify] channel={} attempt {} failed: {}", n.name(), attempt, e.toString());
                Thread.sleep(backoff);
                backoff = Math.min(backoff * 2, maxBackoffMs);
            }
        }
    }

    public void shutdown() {
        exec.shutdown();
    }
}
