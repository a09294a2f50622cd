package com.fastrelay.autoconfig;

import com.fastrelay.core.metric.RelayMeterRegistryProvider;
import com.fastrelay.core.metric.RelayMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.util.stream.Collectors;

/**
 * relay.* 指标, 接入应用已有的 MeterRegistry
 */
@AutoConfiguration
public class RelayMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RelayMeterRegistryProvider relayMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered,
                                                                 Environment env) {
        return new RelayMeterRegistryProvider(discovered.orderedStream().collect(Collectors.toList()),
                env.getProperty("spring.application.name"));
    }

    @Bean
    @ConditionalOnMissingBean
    public RelayMetrics relayMetrics(RelayMeterRegistryProvider provider) {
        return RelayMetrics.create(provider.getRegistry());
    }
}
