package com.fastrelay.core.guard;

import com.fastrelay.config.RelayGuardProperties;
import com.fastrelay.core.metric.RelayMetrics;
import com.fastrelay.core.notify.NotifyContexts;
import com.fastrelay.core.notify.NotifyingFacade;
import com.fastrelay.exception.CircuitOpenException;
import com.fastrelay.exception.PermanentMessageException;
import com.fastrelay.model.CircuitBreakerState;
import com.fastrelay.model.enums.BreakerState;
import com.fastrelay.model.enums.Severity;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 按依赖 key 隔离的熔断器
 * 每个 key 一个 resilience4j CircuitBreaker, 状态迁移由其原子完成, 不同 key 之间互不竞争
 *
 * 语义映射：
 * - 计数窗口 = failureThreshold, 失败率阈值 100% → 连续 N 次失败打开
 * - 半开只放行 1 次试探
 * - 不自动从 OPEN 迁移, 超过 resetTimeout 后由下一次调用触发 HALF_OPEN
 */
public class CircuitBreakerGuard {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerGuard.class);

    private final RelayGuardProperties props;

    private final CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();

    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();

    private final NotifyingFacade notifier;

    private final RelayMetrics metrics;

    private final String nodeId;

    private final Clock clock;

    public CircuitBreakerGuard(RelayGuardProperties props, NotifyingFacade notifier, RelayMetrics metrics, String nodeId) {
        this(props, notifier, metrics, nodeId, Clock.systemUTC());
    }

    public CircuitBreakerGuard(RelayGuardProperties props, NotifyingFacade notifier, RelayMetrics metrics,
                               String nodeId, Clock clock) {
        this.props = props;
        this.notifier = notifier;
        this.metrics = metrics;
        this.nodeId = nodeId;
        this.clock = clock;
        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(registry).bindTo(metrics.registry());
    }

    /**
     * 统一入口
     * OPEN 且未到 resetTimeout 时直接抛 CircuitOpenException, 不调用 operation
     */
    public <T> T execute(String key, Callable<T> operation) throws Exception {
        if (!enabled(key)) {
            return operation.call();
        }
        Slot slot = slots.computeIfAbsent(key, this::build);
        try {
            // Error 包装成异常交给熔断器记一次失败, 出口处还原
            return slot.cb.executeCallable(() -> {
                try {
                    return operation.call();
                } catch (Error err) {
                    throw new ErrorCarrier(err);
                }
            });
        } catch (ErrorCarrier carrier) {
            throw carrier.error;
        } catch (CallNotPermittedException open) {
            // 熔断打开 → 依赖级故障, 交给 Router 按不消耗次数的重试处理
            metrics.incCircuitRejected();
            throw new CircuitOpenException(key, open);
        }
    }

    /**
     * 当前状态快照, 未创建过的 key 视为 CLOSED
     */
    public CircuitBreakerState state(String key) {
        RelayGuardProperties.CbConfig c = configFor(key);
        Slot slot = slots.get(key);
        if (slot == null) {
            return CircuitBreakerState.builder()
                    .key(key)
                    .state(BreakerState.CLOSED)
                    .consecutiveFailures(0)
                    .failureThreshold(c.getFailureThreshold())
                    .resetTimeout(c.getResetTimeout())
                    .build();
        }
        return CircuitBreakerState.builder()
                .key(key)
                .state(map(slot.cb.getState()))
                .consecutiveFailures(slot.consecutiveFailures.get())
                .lastFailureAt(slot.lastFailureAt.get())
                .failureThreshold(c.getFailureThreshold())
                .resetTimeout(c.getResetTimeout())
                .build();
    }

    /**
     * 运维入口：强制回到 CLOSED
     */
    public void reset(String key) {
        Slot slot = slots.get(key);
        if (slot != null) {
            slot.cb.reset();
            slot.consecutiveFailures.set(0);
            log.info("[Relay-Guard] circuit '{}' reset by operator", key);
        }
    }

    public Set<String> keys() {
        return slots.keySet();
    }

    private Slot build(String key) {
        RelayGuardProperties.CbConfig c = configFor(key);
        int threshold = Math.max(1, c.getFailureThreshold());
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100f)
                .slowCallRateThreshold(100f)
                .slowCallDurationThreshold(Duration.ofDays(1))
                .waitDurationInOpenState(c.getResetTimeout())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                // 消息本身无效或停机中断 不代表依赖不健康
                .ignoreExceptions(PermanentMessageException.class, InterruptedException.class)
                .build();
        CircuitBreaker cb = registry.circuitBreaker("cb:" + key, cfg);
        Slot slot = new Slot(cb);
        cb.getEventPublisher()
                .onError(e -> {
                    slot.consecutiveFailures.incrementAndGet();
                    slot.lastFailureAt.set(Instant.now(clock));
                })
                .onSuccess(e -> slot.consecutiveFailures.set(0))
                .onStateTransition(e -> {
                    BreakerState from = map(e.getStateTransition().getFromState());
                    BreakerState to = map(e.getStateTransition().getToState());
                    log.info("[Relay-Guard] circuit '{}' state transition: {} -> {}", key, from, to);
                    if (to == BreakerState.CLOSED) {
                        slot.consecutiveFailures.set(0);
                    }
                    if (to == BreakerState.OPEN) {
                        notifier.fire(NotifyContexts.ctxForCircuitTransition(nodeId, key, from, to), Severity.WARNING);
                    }
                });
        log.info("[Relay-Guard] created circuit breaker '{}' threshold={} resetTimeout={}",
                key, threshold, c.getResetTimeout());
        return slot;
    }

    private RelayGuardProperties.CbConfig configFor(String key) {
        Map<String, RelayGuardProperties.CbConfig> per = props.getCbPerHandler();
        if (per != null && per.get(key) != null) {
            return per.get(key);
        }
        return props.getCircuitBreaker();
    }

    private boolean enabled(String key) {
        return props.isEnabled() && configFor(key).isEnabled();
    }

    private static BreakerState map(CircuitBreaker.State s) {
        return switch (s) {
            case OPEN, FORCED_OPEN -> BreakerState.OPEN;
            case HALF_OPEN -> BreakerState.HALF_OPEN;
            default -> BreakerState.CLOSED;
        };
    }

    private static final class Slot {
        private final CircuitBreaker cb;
        private final AtomicInteger consecutiveFailures = new AtomicInteger();
        private final AtomicReference<Instant> lastFailureAt = new AtomicReference<>();

        private Slot(CircuitBreaker cb) {
            this.cb = cb;
        }
    }

    private static final class ErrorCarrier extends RuntimeException {

        private final Error error;

        private ErrorCarrier(Error error) {
            super(error.toString(), error, false, false);
            this.error = error;
        }
    }
}
