package com.fastrelay.autoconfig;

import com.fastrelay.annotation.EnableRelayWorkers;
import com.fastrelay.core.RelayEngineLifecycle;
import com.fastrelay.core.broker.memory.InMemoryBroker;
import com.fastrelay.core.dlq.DeadLetterManager;
import com.fastrelay.core.dlq.DeadLetterOccupancyMonitor;
import com.fastrelay.core.engine.RelayEngine;
import com.fastrelay.core.guard.CircuitBreakerGuard;
import com.fastrelay.core.router.MessageRouter;
import com.fastrelay.core.spi.MessageHandler;
import com.fastrelay.core.spi.PayloadTransformer;
import com.fastrelay.core.spi.broker.Broker;
import com.fastrelay.core.spi.failure.FailureClassifier;
import com.fastrelay.core.transform.TransformationRegistry;
import com.fastrelay.model.RetryPolicy;
import com.fastrelay.support.ScriptedHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Relay auto-configuration")
class RelayAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    RelayMetricsAutoConfiguration.class,
                    RelayNotifierAutoConfiguration.class,
                    RelayGuardAutoConfiguration.class,
                    FailureClassifierAutoConfiguration.class,
                    RelayBrokerAutoConfiguration.class,
                    RelayAutoConfiguration.class));

    @Configuration(proxyBeanMethods = false)
    static class HandlerConfig {
        @Bean
        MessageHandler ordersHandler() {
            return ScriptedHandler.succeeding("orders");
        }
    }

    @Configuration(proxyBeanMethods = false)
    @EnableRelayWorkers
    static class WorkersConfig {
        @Bean
        MessageHandler ordersHandler() {
            return ScriptedHandler.succeeding("orders");
        }
    }

    @Configuration(proxyBeanMethods = false)
    @EnableRelayWorkers(value = false, handler = "paymentsHandler")
    static class TwoHandlersConfig {
        @Bean
        MessageHandler ordersHandler() {
            return ScriptedHandler.succeeding("orders");
        }

        @Bean
        MessageHandler paymentsHandler() {
            return ScriptedHandler.succeeding("payments");
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class TransformerConfig {
        @Bean
        PayloadTransformer schemaFix() {
            return new PayloadTransformer() {
                @Override
                public byte[] transform(byte[] payload, Throwable error) {
                    return payload;
                }

                @Override
                public Set<String> errorClasses() {
                    return Set.of("schema_version");
                }
            };
        }
    }

    @Test
    @DisplayName("core components exist without a broker, routing does not")
    void withoutBroker() {
        runner.run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx).hasSingleBean(CircuitBreakerGuard.class);
            assertThat(ctx).hasSingleBean(FailureClassifier.class);
            assertThat(ctx).hasSingleBean(TransformationRegistry.class);
            assertThat(ctx).hasSingleBean(RetryPolicy.class);
            assertThat(ctx).doesNotHaveBean(Broker.class);
            assertThat(ctx).doesNotHaveBean(MessageRouter.class);
            assertThat(ctx).doesNotHaveBean(RelayEngine.class);
        });
    }

    @Test
    @DisplayName("in-memory broker with a handler wires the full pipeline")
    void fullPipeline() {
        runner.withUserConfiguration(HandlerConfig.class)
                .withPropertyValues("relay.broker.in-memory=true", "spring.application.name=orders-svc")
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    assertThat(ctx).hasSingleBean(InMemoryBroker.class);
                    assertThat(ctx).hasSingleBean(DeadLetterManager.class);
                    assertThat(ctx).hasSingleBean(DeadLetterOccupancyMonitor.class);
                    assertThat(ctx).hasSingleBean(MessageRouter.class);
                    assertThat(ctx).hasSingleBean(RelayEngineLifecycle.class);
                    RelayEngine engine = ctx.getBean(RelayEngine.class);
                    assertThat(engine.getHandlerName()).isEqualTo("orders");
                    assertThat(engine.getNodeId()).startsWith("orders-svc-");
                    assertThat(engine.isRunning()).isFalse();
                });
    }

    @Test
    @DisplayName("occupancy monitor can be switched off")
    void monitorDisabled() {
        runner.withUserConfiguration(HandlerConfig.class)
                .withPropertyValues("relay.broker.in-memory=true", "relay.dead-letter.monitor.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(DeadLetterOccupancyMonitor.class));
    }

    @Test
    @DisplayName("invalid retry configuration fails startup")
    void invalidRetryPolicy() {
        runner.withPropertyValues("relay.retry.multiplier=1.0")
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure().hasRootCauseInstanceOf(IllegalArgumentException.class));
    }

    @Test
    @DisplayName("transformer beans are registered under their error classes")
    void transformerBeans() {
        runner.withUserConfiguration(TransformerConfig.class)
                .run(ctx -> assertThat(ctx.getBean(TransformationRegistry.class).errorClasses())
                        .contains("schema_version"));
    }

    @Test
    @DisplayName("@EnableRelayWorkers starts the engine with the context")
    void enableRelayWorkers() {
        runner.withUserConfiguration(WorkersConfig.class)
                .withPropertyValues("relay.broker.in-memory=true", "relay.shutdown.await=1s")
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    assertThat(ctx.getBean(RelayEngine.class).isRunning()).isTrue();
                });
    }

    @Test
    @DisplayName("handler named on @EnableRelayWorkers is used when several exist")
    void handlerSelectedByAnnotation() {
        runner.withUserConfiguration(TwoHandlersConfig.class)
                .withPropertyValues("relay.broker.in-memory=true")
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    RelayEngine engine = ctx.getBean(RelayEngine.class);
                    assertThat(engine.getHandlerName()).isEqualTo("payments");
                    assertThat(engine.isRunning()).isFalse();
                });
    }

    @Test
    @DisplayName("several handlers without a selection fail startup")
    void ambiguousHandlers() {
        runner.withBean("a", MessageHandler.class, () -> ScriptedHandler.succeeding("a"))
                .withBean("b", MessageHandler.class, () -> ScriptedHandler.succeeding("b"))
                .withPropertyValues("relay.broker.in-memory=true")
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure().hasRootCauseInstanceOf(IllegalStateException.class));
    }
}
