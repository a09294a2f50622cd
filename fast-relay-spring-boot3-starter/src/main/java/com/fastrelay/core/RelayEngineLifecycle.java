package com.fastrelay.core;

import com.fastrelay.config.RelayGuardProperties;
import com.fastrelay.config.RelayNotifierProperties;
import com.fastrelay.config.RelayProperties;
import com.fastrelay.core.engine.RelayEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class RelayEngineLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(RelayEngineLifecycle.class);

    private final RelayEngine engine;

    private final RelayProperties props;

    private final RelayGuardProperties guardProps;

    private final RelayNotifierProperties notifyProps;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public RelayEngineLifecycle(RelayEngine engine, RelayProperties props,
                                RelayGuardProperties guardProps, RelayNotifierProperties notifyProps) {
        this.engine = engine;
        this.props = props;
        this.guardProps = guardProps;
        this.notifyProps = notifyProps;
    }

    @Override
    public void start() {
        if (!props.getWorkers().isEnabled()) {
            log.info("[Relay-Engine] start skipped, workers disabled (nodeId={})", engine.getNodeId());
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ RelayEngine starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ nodeId               : {}", engine.getNodeId());
            log.info("│ handler              : {}", engine.getHandlerName());
            log.info("│ destinations         : {}", engine.destinations());
            log.info("│ dead-letter          : {}", props.getDestinations().getDeadLetter());
            log.info("│ workers/destination  : {}", props.getWorkers().getPerDestination());
            log.info("│ poll.timeout         : {} ms", props.getWorkers().getPollTimeout().toMillis());
            log.info("│ retry.max            : {}", props.getRetry().getMaxRetries());
            log.info("│ retry.initial        : {} ms", props.getRetry().getInitialInterval().toMillis());
            log.info("│ retry.max-interval   : {} ms", props.getRetry().getMaxInterval().toMillis());
            log.info("│ retry.multiplier     : {}", props.getRetry().getMultiplier());
            log.info("│ retry.jitter         : {}", props.getRetry().getJitterFactor());
            log.info("│ backoff.strategy     : {}", props.getRetry().getStrategy());
            log.info("│ guard.enabled        : {}", guardProps.isEnabled());
            log.info("│ notifier.enabled     : {}", notifyProps.isEnabled());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            // 启动日志打印本身不应阻断启动
            log.warn("[Relay-Engine] failed to render startup banner: {}", t.toString());
        }
        engine.start();
        log.info("[Relay-Engine] started (nodeId={})", engine.getNodeId());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Relay-Engine] stop skipped: not running (nodeId={})", engine.getNodeId());
            return;
        }
        log.info("[Relay-Engine] stopping... (nodeId={})", engine.getNodeId());
        try {
            engine.gracefulShutdown(props.getShutdown().getAwait());
        } finally {
            log.info("[Relay-Engine] stopped (nodeId={})", engine.getNodeId());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
