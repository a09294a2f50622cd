package com.fastrelay.core.dlq;

import com.fastrelay.core.notify.NotifyContexts;
import com.fastrelay.core.notify.NotifyingFacade;
import com.fastrelay.model.enums.Severity;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单线程定时检查死信堆积
 * 超过阈值告警一次, 回落到阈值及以下后重新布防
 */
@Slf4j
public class DeadLetterOccupancyMonitor {

    private final DeadLetterManager manager;

    private final long threshold;

    private final Duration period;

    private final NotifyingFacade notifier;

    private final String nodeId;

    private final String destination;

    private final AtomicBoolean alerted = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;

    public DeadLetterOccupancyMonitor(DeadLetterManager manager, long threshold, Duration period,
                                      NotifyingFacade notifier, String nodeId, String destination) {
        this.manager = manager;
        this.threshold = threshold;
        this.period = period;
        this.notifier = notifier;
        this.nodeId = nodeId;
        this.destination = destination;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("relay-dlq-monitor"));
        long ms = Math.max(1, period.toMillis());
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                check();
            } catch (Exception e) {
                log.error("[Relay-DLQ] occupancy check error", e);
            }
        }, ms, ms, TimeUnit.MILLISECONDS);
        log.info("[Relay-DLQ] occupancy monitor started, period={}ms threshold={}", ms, threshold);
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("[Relay-DLQ] occupancy monitor stopped");
        }
    }

    /**
     * @return 本次是否发出告警
     */
    public boolean check() {
        long occupancy = manager.occupancyCount();
        if (occupancy > threshold) {
            if (alerted.compareAndSet(false, true)) {
                log.warn("[Relay-DLQ] occupancy {} exceeded threshold {}", occupancy, threshold);
                notifier.fire(NotifyContexts.ctxForOccupancy(nodeId, destination, occupancy, threshold),
                        Severity.CRITICAL);
                return true;
            }
            return false;
        }
        if (alerted.compareAndSet(true, false)) {
            log.info("[Relay-DLQ] occupancy {} back under threshold {}", occupancy, threshold);
        }
        return false;
    }

    public boolean isAlerted() {
        return alerted.get();
    }
}
