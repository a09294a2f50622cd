package com.fastrelay.config;

import com.fastrelay.model.enums.NotifyEventType;
import com.fastrelay.model.enums.Severity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * 告警通知配置 relay.notify.*
 * 关闭时所有事件只走 NotifyingFacade 的空实现
 */
@ConfigurationProperties(prefix = "relay.notify")
public class RelayNotifierProperties {

    private boolean enabled = false;

    /** 低于该级别的事件直接丢弃 */
    private Severity minSeverity = Severity.INFO;

    /** 不需要告警的事件类型 */
    private Set<NotifyEventType> muted = EnumSet.noneOf(NotifyEventType.class);

    /** 日志通知里错误描述的最大长度 */
    private int lastErrorMaxLength = 2000;

    private Async async = new Async();

    private Delivery delivery = new Delivery();

    private RateLimit rateLimit = new RateLimit();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Severity getMinSeverity() { return minSeverity; }
    public void setMinSeverity(Severity minSeverity) { this.minSeverity = minSeverity; }
    public Set<NotifyEventType> getMuted() { return muted; }
    public void setMuted(Set<NotifyEventType> muted) { this.muted = muted; }
    public int getLastErrorMaxLength() { return lastErrorMaxLength; }
    public void setLastErrorMaxLength(int lastErrorMaxLength) { this.lastErrorMaxLength = lastErrorMaxLength; }
    public Async getAsync() { return async; }
    public void setAsync(Async async) { this.async = async; }
    public Delivery getDelivery() { return delivery; }
    public void setDelivery(Delivery delivery) { this.delivery = delivery; }
    public RateLimit getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

    /**
     * 通知派发线程池, 队列满时由调用线程执行
     */
    public static class Async {
        private int threads = 2;

        private int queueCapacity = 2000;

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    /**
     * 单个 Notifier 的投递重试
     */
    public static class Delivery {
        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofMillis(200);

        private Duration maxBackoff = Duration.ofSeconds(4);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }

    /**
     * 按 事件类型+handler+destination 分组的窗口限流
     */
    public static class RateLimit {
        private Duration window = Duration.ofSeconds(30);

        private int perGroup = 20;

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
        public int getPerGroup() { return perGroup; }
        public void setPerGroup(int perGroup) { this.perGroup = perGroup; }
    }
}
