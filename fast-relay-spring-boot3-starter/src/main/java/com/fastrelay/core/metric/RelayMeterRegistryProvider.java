package com.fastrelay.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * relay 指标使用的注册表
 * 应用有 MeterRegistry 时写入应用的注册表, 否则落到本地 Simple, 保证计数可读
 */
public class RelayMeterRegistryProvider {

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    public RelayMeterRegistryProvider(List<MeterRegistry> discovered, String application) {
        if (discovered == null || discovered.isEmpty()) {
            composite.add(new SimpleMeterRegistry());
        } else {
            discovered.forEach(this::attach);
        }
        if (application != null && !application.isBlank()) {
            composite.config().commonTags("relay.app", application);
        }
    }

    public RelayMeterRegistryProvider(List<MeterRegistry> discovered) {
        this(discovered, null);
    }

    private void attach(MeterRegistry mr) {
        if (mr instanceof CompositeMeterRegistry) {
            ((CompositeMeterRegistry) mr).getRegistries().forEach(composite::add);
        } else {
            composite.add(mr);
        }
    }

    public MeterRegistry getRegistry() {
        return composite;
    }
}
