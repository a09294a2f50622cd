package com.fastrelay.core.broker.memory;

import com.fastrelay.core.spi.broker.Broker;
import com.fastrelay.core.spi.broker.Subscription;
import com.fastrelay.core.tracker.DeliveryTracker;
import com.fastrelay.exception.BrokerTransportException;
import com.fastrelay.exception.PublishException;
import com.fastrelay.model.AckHandle;
import com.fastrelay.model.Delivery;
import com.fastrelay.model.Message;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 进程内 broker, 用于本地开发和测试
 * - 每个 destination 一个阻塞队列
 * - 带 x-retry-delay-ms 的消息挂到时间轮, 到期后入队
 * - 已投递未确认的消息记录在 inFlight, nack(requeue) 时经 redeliveryDelay 后重新入队
 */
@Slf4j
public class InMemoryBroker implements Broker, AutoCloseable {

    public static final Duration DEFAULT_REDELIVERY_DELAY = Duration.ofMillis(500);

    private final Map<String, BlockingQueue<Message>> queues = new ConcurrentHashMap<>();

    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

    /** 模拟不可达的 destination */
    private final Set<String> unavailable = ConcurrentHashMap.newKeySet();

    private final AtomicLong tagSeq = new AtomicLong();

    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final Timer timer;

    /** nack(requeue) 后重新可见前的等待, 避免被拒消息在同一队列上空转 */
    private final Duration redeliveryDelay;

    public InMemoryBroker(Timer timer, Duration redeliveryDelay) {
        if (redeliveryDelay == null || redeliveryDelay.isNegative()) {
            throw new IllegalArgumentException("redeliveryDelay must be >= 0");
        }
        this.timer = timer;
        this.redeliveryDelay = redeliveryDelay;
    }

    public InMemoryBroker(Timer timer) {
        this(timer, DEFAULT_REDELIVERY_DELAY);
    }

    public InMemoryBroker(Duration redeliveryDelay) {
        this(new HashedWheelTimer(new NamedThreadFactory("relay-broker-wheel"),
                10, TimeUnit.MILLISECONDS, 512, false, 100_000), redeliveryDelay);
    }

    public InMemoryBroker() {
        this(DEFAULT_REDELIVERY_DELAY);
    }

    @Override
    public void publish(String destination, Message message) throws PublishException {
        if (closed.get()) {
            throw new PublishException(destination, "broker closed");
        }
        if (unavailable.contains(destination)) {
            throw new PublishException(destination, "destination unavailable: " + destination);
        }
        Duration delay = DeliveryTracker.delayOf(message);
        if (delay.isZero()) {
            queue(destination).offer(message);
            return;
        }
        try {
            timer.newTimeout(t -> queue(destination).offer(message), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException | IllegalStateException e) {
            throw new PublishException(destination, "delayed publish rejected", e);
        }
    }

    @Override
    public Subscription consume(String destination) {
        if (closed.get()) {
            throw new BrokerTransportException("broker closed");
        }
        return new QueueSubscription(destination, queue(destination));
    }

    @Override
    public void ack(AckHandle handle) {
        inFlight.remove(handle.getDeliveryTag());
    }

    @Override
    public void nack(AckHandle handle, boolean requeue) {
        InFlight f = inFlight.remove(handle.getDeliveryTag());
        if (f == null || !requeue || closed.get()) {
            return;
        }
        if (redeliveryDelay.isZero()) {
            queue(f.destination).offer(f.message);
            return;
        }
        try {
            timer.newTimeout(t -> queue(f.destination).offer(f.message),
                    redeliveryDelay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException | IllegalStateException e) {
            // 时间轮已停或已满, 直接入队保证不丢
            log.warn("[Relay-Broker] delayed redelivery rejected on {}, requeue now: {}", f.destination, e.toString());
            queue(f.destination).offer(f.message);
        }
    }

    public Duration getRedeliveryDelay() {
        return redeliveryDelay;
    }

    public void markUnavailable(String destination) {
        unavailable.add(destination);
    }

    public void markAvailable(String destination) {
        unavailable.remove(destination);
    }

    /** 队列中可投递的消息数, 不含时间轮中挂起的 */
    public int size(String destination) {
        BlockingQueue<Message> q = queues.get(destination);
        return q == null ? 0 : q.size();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /** 取走 destination 中当前全部消息 */
    public List<Message> drain(String destination) {
        List<Message> out = new ArrayList<>();
        BlockingQueue<Message> q = queues.get(destination);
        if (q != null) {
            q.drainTo(out);
        }
        return out;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            int pending = timer.stop().size();
            log.info("[Relay-Broker] in-memory broker closed, dropped {} delayed messages", pending);
        }
    }

    private BlockingQueue<Message> queue(String destination) {
        return queues.computeIfAbsent(destination, d -> new LinkedBlockingQueue<>());
    }

    private static final class InFlight {
        private final String destination;
        private final Message message;

        private InFlight(String destination, Message message) {
            this.destination = destination;
            this.message = message;
        }
    }

    private final class QueueSubscription implements Subscription {

        private final String destination;

        private final BlockingQueue<Message> queue;

        private volatile boolean subscriptionClosed;

        private QueueSubscription(String destination, BlockingQueue<Message> queue) {
            this.destination = destination;
            this.queue = queue;
        }

        @Override
        public Optional<Delivery> poll(Duration timeout) throws InterruptedException {
            if (subscriptionClosed) {
                throw new IllegalStateException("subscription closed: " + destination);
            }
            if (closed.get()) {
                throw new BrokerTransportException("broker closed");
            }
            Message m = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (m == null) {
                return Optional.empty();
            }
            String tag = destination + "#" + tagSeq.incrementAndGet();
            inFlight.put(tag, new InFlight(destination, m));
            return Optional.of(new Delivery(m, new AckHandle(destination, tag)));
        }

        @Override
        public boolean isClosed() {
            return subscriptionClosed;
        }

        @Override
        public void close() {
            subscriptionClosed = true;
        }
    }
}
