package com.fastrelay.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fastrelay.annotation.EnableRelayWorkers;
import com.fastrelay.config.RelayGuardProperties;
import com.fastrelay.config.RelayNotifierProperties;
import com.fastrelay.config.RelayProperties;
import com.fastrelay.core.RelayEngineLifecycle;
import com.fastrelay.core.RelayNode;
import com.fastrelay.core.backoff.BackoffRegistry;
import com.fastrelay.core.backoff.RetryScheduler;
import com.fastrelay.core.dlq.DeadLetterManager;
import com.fastrelay.core.dlq.DeadLetterOccupancyMonitor;
import com.fastrelay.core.dlq.InMemoryDeadLetterStore;
import com.fastrelay.core.engine.RelayEngine;
import com.fastrelay.core.guard.CircuitBreakerGuard;
import com.fastrelay.core.metric.RelayMetrics;
import com.fastrelay.core.notify.NotifyingFacade;
import com.fastrelay.core.router.MessageRouter;
import com.fastrelay.core.spi.BackoffPolicy;
import com.fastrelay.core.spi.DeadLetterStore;
import com.fastrelay.core.spi.MessageHandler;
import com.fastrelay.core.spi.PayloadTransformer;
import com.fastrelay.core.spi.broker.Broker;
import com.fastrelay.core.spi.failure.FailureClassifier;
import com.fastrelay.core.tracker.DeliveryTracker;
import com.fastrelay.core.transform.TransformationRegistry;
import com.fastrelay.model.RetryPolicy;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * 重试/死信/熔断核心组件与消费引擎
 * 路由与引擎只在存在 Broker 时装配, 引擎另需 MessageHandler
 */
@AutoConfiguration(after = {
        RelayMetricsAutoConfiguration.class,
        RelayNotifierAutoConfiguration.class,
        RelayGuardAutoConfiguration.class,
        FailureClassifierAutoConfiguration.class,
        RelayBrokerAutoConfiguration.class
})
@EnableConfigurationProperties({
        RelayProperties.class,
        RelayGuardProperties.class,
        RelayNotifierProperties.class
})
public class RelayAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DeliveryTracker deliveryTracker(ObjectProvider<ObjectMapper> mapper) {
        return new DeliveryTracker(mapper.getIfAvailable(ObjectMapper::new));
    }

    /**
     * 策略注册中心
     */
    @Bean
    @ConditionalOnMissingBean
    public BackoffRegistry backoffRegistry(ObjectProvider<BackoffPolicy> discovered) {
        return new BackoffRegistry(discovered.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryScheduler retryScheduler(BackoffRegistry registry) {
        return new RetryScheduler(registry);
    }

    /**
     * 启动时校验, 非法配置直接启动失败
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy relayRetryPolicy(RelayProperties props) {
        return props.toRetryPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public TransformationRegistry transformationRegistry(RelayProperties props, RelayMetrics metrics,
                                                         ObjectProvider<PayloadTransformer> transformers) {
        return new TransformationRegistry(
                TransformationRegistry.defaultFor(props.getTransform().getDefaultTransformer()),
                metrics,
                transformers.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean(DeadLetterStore.class)
    public DeadLetterStore deadLetterStore() {
        return new InMemoryDeadLetterStore();
    }

    @Bean
    @ConditionalOnBean(Broker.class)
    @ConditionalOnMissingBean
    public DeadLetterManager deadLetterManager(Broker broker, DeadLetterStore store, DeliveryTracker tracker,
                                               RelayProperties props, RetryPolicy policy,
                                               NotifyingFacade notifier, RelayMetrics metrics, RelayNode node) {
        DeadLetterManager manager = new DeadLetterManager(broker, store, tracker, props.getDestinations(),
                policy, notifier, metrics, Clock.systemUTC(), node.getId());
        metrics.bindDlqOccupancy(manager::occupancyCount);
        return manager;
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnBean(Broker.class)
    @ConditionalOnProperty(prefix = "relay.dead-letter.monitor", name = "enabled", matchIfMissing = true)
    @ConditionalOnMissingBean
    public DeadLetterOccupancyMonitor deadLetterOccupancyMonitor(DeadLetterManager manager, RelayProperties props,
                                                                 NotifyingFacade notifier, RelayNode node) {
        RelayProperties.DeadLetter.Monitor m = props.getDeadLetter().getMonitor();
        return new DeadLetterOccupancyMonitor(manager, m.getThreshold(), m.getPeriod(), notifier,
                node.getId(), props.getDestinations().getDeadLetter());
    }

    @Bean
    @ConditionalOnBean(Broker.class)
    @ConditionalOnMissingBean
    public MessageRouter messageRouter(Broker broker, DeliveryTracker tracker, RetryScheduler scheduler,
                                       RetryPolicy policy, CircuitBreakerGuard guard, FailureClassifier classifier,
                                       TransformationRegistry transforms, DeadLetterManager deadLetters,
                                       RelayProperties props, NotifyingFacade notifier, RelayMetrics metrics,
                                       RelayNode node) {
        return new MessageRouter(broker, tracker, scheduler, policy, guard, classifier, transforms, deadLetters,
                props.getDestinations(), notifier, metrics, Clock.systemUTC(), node.getId());
    }

    /**
     * 消费引擎
     */
    @Bean
    @ConditionalOnBean({Broker.class, MessageHandler.class})
    @ConditionalOnMissingBean
    public RelayEngine relayEngine(Broker broker, MessageRouter router, RelayProperties props,
                                   NotifyingFacade notifier, RelayMetrics metrics, RelayNode node,
                                   ApplicationContext applicationContext) {
        applyEnableRelayWorkers(applicationContext, props);
        MessageHandler handler = resolveHandler(applicationContext, props);
        return new RelayEngine(broker, router, handler, props, notifier, metrics, node.getId());
    }

    /**
     * 消费引擎启动器
     */
    @Bean
    @ConditionalOnBean({Broker.class, MessageHandler.class})
    @ConditionalOnMissingBean
    public RelayEngineLifecycle relayEngineLifecycle(RelayEngine engine,
                                                     RelayProperties props,
                                                     RelayGuardProperties guardProps,
                                                     RelayNotifierProperties notifyProps,
                                                     ApplicationContext applicationContext) {
        applyEnableRelayWorkers(applicationContext, props);
        return new RelayEngineLifecycle(engine, props, guardProps, notifyProps);
    }

    private static MessageHandler resolveHandler(ApplicationContext ctx, RelayProperties props) {
        String name = props.getWorkers().getHandler();
        if (name != null && !name.isBlank()) {
            return ctx.getBean(name, MessageHandler.class);
        }
        MessageHandler unique = ctx.getBeanProvider(MessageHandler.class).getIfUnique();
        if (unique == null) {
            throw new IllegalStateException("Multiple MessageHandler beans found, set relay.workers.handler");
        }
        return unique;
    }

    private static void applyEnableRelayWorkers(ListableBeanFactory factory, RelayProperties props) {
        EnableRelayWorkers an = findEnableRelayWorkers(factory);
        if (an != null) {
            props.getWorkers().setEnabled(an.value());
            if (!an.handler().isBlank()) {
                props.getWorkers().setHandler(an.handler());
            }
        }
    }

    private static EnableRelayWorkers findEnableRelayWorkers(ListableBeanFactory factory) {
        for (String n : factory.getBeanNamesForAnnotation(EnableRelayWorkers.class)) {
            EnableRelayWorkers an = factory.findAnnotationOnBean(n, EnableRelayWorkers.class);
            if (an != null) return an;
        }
        return null;
    }
}
