package com.fastrelay.autoconfig;

import com.fastrelay.config.RelayGuardProperties;
import com.fastrelay.core.RelayNode;
import com.fastrelay.core.guard.CircuitBreakerGuard;
import com.fastrelay.core.metric.RelayMetrics;
import com.fastrelay.core.notify.NotifyingFacade;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@AutoConfiguration(after = {RelayMetricsAutoConfiguration.class, RelayNotifierAutoConfiguration.class})
@EnableConfigurationProperties({
        RelayGuardProperties.class
})
public class RelayGuardAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RelayNode relayNode(Environment env) {
        return RelayNode.of(env.getProperty("spring.application.name"));
    }

    /**
     * handler 统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerGuard circuitBreakerGuard(RelayGuardProperties props, NotifyingFacade notifier,
                                                   RelayMetrics metrics, RelayNode node) {
        return new CircuitBreakerGuard(props, notifier, metrics, node.getId());
    }
}
