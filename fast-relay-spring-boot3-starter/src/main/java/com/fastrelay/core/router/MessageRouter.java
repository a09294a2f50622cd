package com.fastrelay.core.router;

import com.fastrelay.config.RelayProperties;
import com.fastrelay.core.backoff.RetryScheduler;
import com.fastrelay.core.dlq.DeadLetterManager;
import com.fastrelay.core.guard.CircuitBreakerGuard;
import com.fastrelay.core.metric.RelayMetrics;
import com.fastrelay.core.notify.NotifyContexts;
import com.fastrelay.core.notify.NotifyingFacade;
import com.fastrelay.core.spi.MessageHandler;
import com.fastrelay.core.spi.broker.Broker;
import com.fastrelay.core.spi.failure.FailureClassifier;
import com.fastrelay.core.tracker.DeliveryTracker;
import com.fastrelay.core.transform.TransformationRegistry;
import com.fastrelay.exception.PublishException;
import com.fastrelay.model.AckHandle;
import com.fastrelay.model.Delivery;
import com.fastrelay.model.Message;
import com.fastrelay.model.RetryPolicy;
import com.fastrelay.model.RetryState;
import com.fastrelay.model.enums.FailureKind;
import com.fastrelay.model.enums.RoutingOutcome;
import com.fastrelay.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 单条投递的路由决策
 * 决策只依赖消息属性和熔断器状态, 重复投递得到相同结果
 *
 * - 成功 → ack
 * - 熔断打开 → 原级别重试 destination, 不消耗 attempt
 * - 可重试失败且未耗尽 → 转换负载, 投递到 retry.{attempt}, ack
 * - 耗尽或永久失败 → 死信, ack
 * - 投递失败 → nack(requeue), 原消息绝不 ack
 */
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final Broker broker;

    private final DeliveryTracker tracker;

    private final RetryScheduler scheduler;

    private final RetryPolicy policy;

    private final CircuitBreakerGuard guard;

    private final FailureClassifier classifier;

    private final TransformationRegistry transforms;

    private final DeadLetterManager deadLetters;

    private final RelayProperties.Destinations destinations;

    private final NotifyingFacade notifier;

    private final RelayMetrics metrics;

    private final Clock clock;

    private final String nodeId;

    public MessageRouter(Broker broker,
                         DeliveryTracker tracker,
                         RetryScheduler scheduler,
                         RetryPolicy policy,
                         CircuitBreakerGuard guard,
                         FailureClassifier classifier,
                         TransformationRegistry transforms,
                         DeadLetterManager deadLetters,
                         RelayProperties.Destinations destinations,
                         NotifyingFacade notifier,
                         RelayMetrics metrics,
                         Clock clock,
                         String nodeId) {
        this.broker = broker;
        this.tracker = tracker;
        this.scheduler = scheduler;
        this.policy = policy;
        this.guard = guard;
        this.classifier = classifier;
        this.transforms = transforms;
        this.deadLetters = deadLetters;
        this.destinations = destinations;
        this.notifier = notifier;
        this.metrics = metrics;
        this.clock = clock;
        this.nodeId = nodeId;
    }

    public RoutingOutcome handle(Delivery delivery, MessageHandler handler) {
        Message message = delivery.getMessage();
        AckHandle handle = delivery.getHandle();
        RetryState state = tracker.read(message);

        long startNanos = System.nanoTime();
        try {
            guard.execute(handler.name(), () -> {
                handler.handle(message.getPayload(), message);
                return null;
            });
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return abandon(handle, handler);
        } catch (Throwable e) {
            // Error 同样按失败路由, 原消息必须被 ack 或 nack
            metrics.recordExecNanos(System.nanoTime() - startNanos);
            if (Thread.currentThread().isInterrupted()) {
                // 停机中断导致的失败不计入重试
                return abandon(handle, handler);
            }
            return onFailure(delivery, handler, state, e);
        }
        metrics.recordExecNanos(System.nanoTime() - startNanos);
        broker.ack(handle);
        metrics.incAcked();
        metrics.recordAttempts(state.getAttempt());
        if (log.isDebugEnabled()) {
            log.debug("[Relay-Router] acked handler={} from={} attempt={}",
                    handler.name(), handle.getDestination(), state.getAttempt());
        }
        return RoutingOutcome.ACKNOWLEDGED;
    }

    private RoutingOutcome onFailure(Delivery delivery, MessageHandler handler, RetryState state, Throwable error) {
        Message message = delivery.getMessage();
        AckHandle handle = delivery.getHandle();
        FailureClassifier.Classification c = classifier.classify(error);
        Instant now = Instant.now(clock);
        String target = null;
        try {
            if (c.getKind() == FailureKind.CIRCUIT_OPEN) {
                if (DeliveryTracker.exhausted(state, policy)) {
                    // 终态消息不得进入重试 destination, 交回 broker 稍后重投
                    log.debug("[Relay-Router] circuit open on terminal attempt, requeue. handler={} attempt={}",
                            handler.name(), state.getAttempt());
                    return requeue(handle);
                }
                Duration delay = scheduler.nextDelay(state.getAttempt(), policy);
                Message next = tracker.withDelay(tracker.stamp(message, state.rejected(now, c.getErrorClass())), delay);
                target = destinations.retry(state.getAttempt());
                broker.publish(target, next);
                broker.ack(handle);
                metrics.incRetried();
                log.info("[Relay-Router] circuit open for handler={}, deferred to {} in {}ms, attempt unchanged={}",
                        handler.name(), target, delay.toMillis(), state.getAttempt());
                return RoutingOutcome.RETRIED;
            }

            metrics.incFailed();
            if (c.getKind() == FailureKind.PERMANENT || DeliveryTracker.exhausted(state, policy)) {
                target = destinations.getDeadLetter();
                deadLetters.archive(message, error, c, handler.name());
                broker.ack(handle);
                return RoutingOutcome.DEAD_LETTERED;
            }

            byte[] payload = transforms.apply(c.getErrorClass(), message.getPayload(), error);
            Duration delay = scheduler.nextDelay(state.getAttempt(), policy);
            RetryState next = state.nextFailure(now, c.getErrorClass());
            Message out = tracker.withDelay(tracker.stamp(message.withPayload(payload), next), delay);
            target = destinations.retry(state.getAttempt());
            broker.publish(target, out);
            broker.ack(handle);
            metrics.incRetried();
            log.info("[Relay-Router] handler={} failed errorClass={}, retry {}/{} via {} in {}ms",
                    handler.name(), c.getErrorClass(), next.getAttempt(), policy.getMaxRetries(),
                    target, delay.toMillis());
            return RoutingOutcome.RETRIED;
        } catch (PublishException pe) {
            log.error("[Relay-Router] publish to {} failed, nack for redelivery. handler={} attempt={}",
                    pe.getDestination() == null ? target : pe.getDestination(), handler.name(), state.getAttempt(), pe);
            notifier.fire(NotifyContexts.ctxForPublishFail(nodeId, handler.name(),
                    pe.getDestination() == null ? target : pe.getDestination(), state.getAttempt(), pe, clock),
                    Severity.ERROR);
            return requeue(handle);
        } catch (RuntimeException | Error unexpected) {
            // 分类/转换/存储自身出错时不丢消息
            log.error("[Relay-Router] routing failed, nack for redelivery. handler={} attempt={}",
                    handler.name(), state.getAttempt(), unexpected);
            return requeue(handle);
        }
    }

    private RoutingOutcome abandon(AckHandle handle, MessageHandler handler) {
        log.warn("[Relay-Router] handler={} interrupted, delivery abandoned for redelivery", handler.name());
        return requeue(handle);
    }

    private RoutingOutcome requeue(AckHandle handle) {
        broker.nack(handle, true);
        metrics.incRequeued();
        return RoutingOutcome.REQUEUED;
    }
}
