package com.fastrelay.core.engine;

import com.fastrelay.config.RelayProperties;
import com.fastrelay.core.metric.RelayMetrics;
import com.fastrelay.core.notify.NotifyContexts;
import com.fastrelay.core.notify.NotifyingFacade;
import com.fastrelay.core.router.MessageRouter;
import com.fastrelay.core.spi.MessageHandler;
import com.fastrelay.core.spi.broker.Broker;
import com.fastrelay.core.spi.broker.Subscription;
import com.fastrelay.exception.BrokerTransportException;
import com.fastrelay.model.Delivery;
import com.fastrelay.model.enums.Severity;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 消费引擎
 * main 与每个 retry.{level} 各跑 perDestination 个 worker, 每个 worker 处理完一条再拉取下一条
 */
public class RelayEngine {

    private static final Logger log = LoggerFactory.getLogger(RelayEngine.class);

    private final Broker broker;

    private final MessageRouter router;

    private final MessageHandler handler;

    private final RelayProperties props;

    private final NotifyingFacade notifier;

    private final RelayMetrics metrics;

    private final String nodeId;

    /** 引擎运行状态 */
    private final AtomicBoolean running = new AtomicBoolean(false);

    /** 正在处理的投递数 */
    private final AtomicInteger inFlight = new AtomicInteger();

    private volatile ExecutorService workers;

    public RelayEngine(Broker broker,
                       MessageRouter router,
                       MessageHandler handler,
                       RelayProperties props,
                       NotifyingFacade notifier,
                       RelayMetrics metrics,
                       String nodeId) {
        this.broker = broker;
        this.router = router;
        this.handler = handler;
        this.props = props;
        this.notifier = notifier;
        this.metrics = metrics;
        this.nodeId = nodeId;
    }

    public String getNodeId() { return nodeId; }

    public String getHandlerName() { return handler.name(); }

    public boolean isRunning() { return running.get(); }

    public int inFlightCount() { return inFlight.get(); }

    /**
     * 消费的 destination: main, retry.0 ... retry.{maxRetries-1}
     */
    public List<String> destinations() {
        RelayProperties.Destinations d = props.getDestinations();
        List<String> out = new ArrayList<>();
        out.add(d.getMain());
        for (int level = 0; level < props.getRetry().getMaxRetries(); level++) {
            out.add(d.retry(level));
        }
        return out;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        List<String> dests = destinations();
        int per = Math.max(1, props.getWorkers().getPerDestination());
        workers = Executors.newFixedThreadPool(dests.size() * per, new NamedThreadFactory("relay-worker"));
        for (String dest : dests) {
            for (int i = 0; i < per; i++) {
                workers.execute(() -> workerLoop(dest));
            }
        }
        log.info("[Relay-Engine] {} workers started on {} (nodeId={})", dests.size() * per, dests, nodeId);
    }

    private void workerLoop(String destination) {
        Duration pollTimeout = props.getWorkers().getPollTimeout();
        Subscription sub = null;
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                try {
                    if (sub == null || sub.isClosed()) {
                        sub = broker.consume(destination);
                    }
                    Optional<Delivery> next = sub.poll(pollTimeout);
                    if (next.isEmpty()) {
                        continue;
                    }
                    inFlight.incrementAndGet();
                    try {
                        router.handle(next.get(), handler);
                    } finally {
                        inFlight.decrementAndGet();
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                } catch (BrokerTransportException e) {
                    // 重连由 broker 客户端负责, 这里只丢弃订阅并暂停
                    log.error("[Relay-Engine] broker transport error on {}: {}", destination, e.getMessage());
                    onEngineError(destination, e);
                    closeQuietly(sub);
                    sub = null;
                    pause();
                } catch (RuntimeException | Error e) {
                    // worker 循环不能因单次异常退出, 否则该 destination 不再被消费
                    log.error("[Relay-Engine] worker error on {}", destination, e);
                    onEngineError(destination, e);
                    pause();
                }
            }
        } finally {
            closeQuietly(sub);
        }
    }

    private void onEngineError(String destination, Throwable e) {
        metrics.incEngineErr();
        notifier.fire(NotifyContexts.ctxForEngineError(nodeId, destination, e), Severity.ERROR);
    }

    private void pause() {
        try {
            Thread.sleep(Math.max(1, props.getWorkers().getErrorBackoff().toMillis()));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeQuietly(Subscription sub) {
        if (sub == null) {
            return;
        }
        try {
            sub.close();
        } catch (RuntimeException e) {
            log.warn("[Relay-Engine] subscription close failed: {}", e.toString());
        }
    }

    /**
     * 停止拉取, 等待在途投递完成, 超时后中断
     * 被中断的投递不确认, 由 broker 重投
     */
    public synchronized void gracefulShutdown(Duration await) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ExecutorService exec = workers;
        if (exec == null) {
            return;
        }
        exec.shutdown();
        long awaitMs = Math.max(1, await.toMillis());
        try {
            if (!exec.awaitTermination(awaitMs, TimeUnit.MILLISECONDS)) {
                log.warn("[Relay-Engine] workers still busy after {} ms, interrupting {} in-flight",
                        awaitMs, inFlight.get());
                exec.shutdownNow();
                if (!exec.awaitTermination(2000, TimeUnit.MILLISECONDS)) {
                    log.warn("[Relay-Engine] workers did not terminate after interrupt");
                }
            }
        } catch (InterruptedException ie) {
            exec.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Relay-Engine] graceful shutdown done (nodeId={})", nodeId);
    }
}
