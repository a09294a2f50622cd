package com.fastrelay.autoconfig;

import com.fastrelay.config.RelayProperties;
import com.fastrelay.core.broker.memory.InMemoryBroker;
import com.fastrelay.core.spi.broker.Broker;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

/**
 * 本地开发/测试用的内存 broker, relay.broker.in-memory=true 时启用
 */
@AutoConfiguration
@EnableConfigurationProperties(RelayProperties.class)
@ConditionalOnProperty(prefix = "relay.broker", name = "in-memory", havingValue = "true")
public class RelayBrokerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(Broker.class)
    public InMemoryBroker inMemoryBroker(RelayProperties props) {
        RelayProperties.Wheel wheel = props.getBroker().getWheel();
        HashedWheelTimer timer = new HashedWheelTimer(
                new NamedThreadFactory("relay-broker-wheel"),
                wheel.getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                wheel.getTicksPerWheel(),
                false,
                wheel.getMaxPendingTimeouts()
        );
        return new InMemoryBroker(timer, props.getBroker().getRedeliveryDelay());
    }
}
