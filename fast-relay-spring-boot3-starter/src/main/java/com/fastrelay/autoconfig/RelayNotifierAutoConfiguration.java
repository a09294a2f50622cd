package com.fastrelay.autoconfig;

import com.fastrelay.config.RelayNotifierProperties;
import com.fastrelay.core.metric.RelayMetrics;
import com.fastrelay.core.notify.AsyncNotifyingService;
import com.fastrelay.core.notify.NotifyingFacade;
import com.fastrelay.core.notify.SeverityFilter;
import com.fastrelay.core.notify.notifier.LoggingNotifier;
import com.fastrelay.core.notify.ratelimit.RateLimitFilter;
import com.fastrelay.core.notify.route.SimpleRouter;
import com.fastrelay.core.spi.notify.Notifier;
import com.fastrelay.core.spi.notify.NotifierFilter;
import com.fastrelay.core.spi.notify.NotifierRouter;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 告警通知: 日志渠道 + 应用注册的 Notifier, relay.notify.enabled=true 时异步派发
 */
@AutoConfiguration(after = RelayMetricsAutoConfiguration.class)
@EnableConfigurationProperties(RelayNotifierProperties.class)
public class RelayNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier(RelayNotifierProperties props) {
        return new LoggingNotifier(props.getLastErrorMaxLength());
    }

    @Bean
    @ConditionalOnMissingBean(NotifierRouter.class)
    public NotifierRouter notifierRouter(ObjectProvider<Notifier> notifiers) {
        return new SimpleRouter(notifiers.orderedStream().collect(Collectors.toList()));
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "relay.notify", name = "enabled", havingValue = "true")
    public AsyncNotifyingService asyncNotifyingService(NotifierRouter router,
                                                       RelayMetrics metrics,
                                                       RelayNotifierProperties props,
                                                       ObjectProvider<NotifierFilter> extraFilters) {
        RelayNotifierProperties.Async pool = props.getAsync();
        int threads = Math.max(1, pool.getThreads());
        ThreadPoolExecutor exec = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, pool.getQueueCapacity())),
                new NamedThreadFactory("relay-notify"),
                new ThreadPoolExecutor.CallerRunsPolicy());
        exec.allowCoreThreadTimeOut(true);

        // 先按级别/静默过滤, 再限流, 被拒的事件不占限流额度
        List<NotifierFilter> filters = new ArrayList<>();
        filters.add(new SeverityFilter(props.getMinSeverity(), props.getMuted()));
        filters.add(new RateLimitFilter(props.getRateLimit().getWindow(), props.getRateLimit().getPerGroup()));
        extraFilters.orderedStream().forEach(filters::add);

        RelayNotifierProperties.Delivery d = props.getDelivery();
        return new AsyncNotifyingService(exec, router, filters, metrics,
                d.getMaxAttempts(), d.getInitialBackoff(), d.getMaxBackoff());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifyingFacade notifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        return new NotifyingFacade(provider);
    }
}
