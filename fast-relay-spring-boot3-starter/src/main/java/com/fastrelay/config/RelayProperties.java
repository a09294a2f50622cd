package com.fastrelay.config;

import com.fastrelay.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 消息中继核心配置（绑定前缀：relay）
 *
 * YAML 示例：
 * relay:
 *   destinations:
 *     main: main
 *     retry-prefix: retry.
 *     dead-letter: dead-letter
 *   retry:
 *     max-retries: 3
 *     initial-interval: 1s
 *     max-interval: 5m
 *     multiplier: 2.0
 *     jitter-factor: 0.2
 *     strategy: exponential
 *   workers:
 *     enabled: true
 *     per-destination: 2
 *     poll-timeout: 500ms
 *     error-backoff: 1s
 *     handler: orderHandler
 *   shutdown:
 *     await: 30s
 *   dead-letter:
 *     monitor:
 *       enabled: true
 *       period: 30s
 *       threshold: 100
 *   transform:
 *     default-transformer: identity
 *   broker:
 *     in-memory: false
 *     wheel:
 *       tick-duration: 100ms
 *       ticks-per-wheel: 512
 */
@Validated
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private Destinations destinations = new Destinations();

    private Retry retry = new Retry();

    private Workers workers = new Workers();

    private Shutdown shutdown = new Shutdown();

    private DeadLetter deadLetter = new DeadLetter();

    private Transform transform = new Transform();

    private BrokerCfg broker = new BrokerCfg();

    // ----------------- 嵌套配置对象 -----------------

    public static class Destinations {
        private String main = "main";

        /** 重试 destination 前缀, 层级拼接在后：retry.0, retry.1 ... */
        private String retryPrefix = "retry.";

        private String deadLetter = "dead-letter";

        public String getMain() { return main; }
        public void setMain(String main) { this.main = main; }
        public String getRetryPrefix() { return retryPrefix; }
        public void setRetryPrefix(String retryPrefix) { this.retryPrefix = retryPrefix; }
        public String getDeadLetter() { return deadLetter; }
        public void setDeadLetter(String deadLetter) { this.deadLetter = deadLetter; }

        /** 第 level 级重试 destination */
        public String retry(int level) { return retryPrefix + level; }
    }

    public static class Retry {
        /** 最大重试次数 */
        private int maxRetries = 3;

        /** 首次重试间隔 */
        private Duration initialInterval = Duration.ofSeconds(1);

        /** 最大间隔 */
        private Duration maxInterval = Duration.ofMinutes(5);

        /** 指数倍率, 必须 > 1 */
        private double multiplier = 2.0;

        /** 抖动比例（0~1），例如 0.2 表示 ±20% */
        private double jitterFactor = 0.2;

        /** 策略：fixed | exponential | spi:{name} */
        private String strategy = "exponential";

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getInitialInterval() { return initialInterval; }
        public void setInitialInterval(Duration initialInterval) { this.initialInterval = initialInterval; }
        public Duration getMaxInterval() { return maxInterval; }
        public void setMaxInterval(Duration maxInterval) { this.maxInterval = maxInterval; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }
        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
    }

    public static class Workers {
        /** 是否启动消费 worker */
        private boolean enabled = false;

        /** 每个 destination 的 worker 数 */
        private int perDestination = 2;

        /** 单次拉取最长等待 */
        private Duration pollTimeout = Duration.ofMillis(500);

        /** broker 传输异常后的暂停 */
        private Duration errorBackoff = Duration.ofSeconds(1);

        /** 多个 MessageHandler 时指定 bean 名称 */
        private String handler;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getPerDestination() { return perDestination; }
        public void setPerDestination(int perDestination) { this.perDestination = perDestination; }
        public Duration getPollTimeout() { return pollTimeout; }
        public void setPollTimeout(Duration pollTimeout) { this.pollTimeout = pollTimeout; }
        public Duration getErrorBackoff() { return errorBackoff; }
        public void setErrorBackoff(Duration errorBackoff) { this.errorBackoff = errorBackoff; }
        public String getHandler() { return handler; }
        public void setHandler(String handler) { this.handler = handler; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    public static class DeadLetter {
        private Monitor monitor = new Monitor();

        public Monitor getMonitor() { return monitor; }
        public void setMonitor(Monitor monitor) { this.monitor = monitor; }

        public static class Monitor {
            private boolean enabled = true;

            /** 轮询周期 */
            private Duration period = Duration.ofSeconds(30);

            /** 未重放死信数超过该值告警 */
            private long threshold = 100;

            public boolean isEnabled() { return enabled; }
            public void setEnabled(boolean enabled) { this.enabled = enabled; }
            public Duration getPeriod() { return period; }
            public void setPeriod(Duration period) { this.period = period; }
            public long getThreshold() { return threshold; }
            public void setThreshold(long threshold) { this.threshold = threshold; }
        }
    }

    public static class Transform {
        /** 未匹配错误分类时：identity | logging */
        private String defaultTransformer = "identity";

        public String getDefaultTransformer() { return defaultTransformer; }
        public void setDefaultTransformer(String defaultTransformer) { this.defaultTransformer = defaultTransformer; }
    }

    public static class BrokerCfg {
        /** 启用内存 broker（本地开发/测试） */
        private boolean inMemory = false;

        private Wheel wheel = new Wheel();

        /** nack(requeue) 后重新投递前的等待 */
        private Duration redeliveryDelay = Duration.ofSeconds(1);

        public boolean isInMemory() { return inMemory; }
        public void setInMemory(boolean inMemory) { this.inMemory = inMemory; }
        public Duration getRedeliveryDelay() { return redeliveryDelay; }
        public void setRedeliveryDelay(Duration redeliveryDelay) { this.redeliveryDelay = redeliveryDelay; }
        public Wheel getWheel() { return wheel; }
        public void setWheel(Wheel wheel) { this.wheel = wheel; }
    }

    public static class Wheel {
        /** 时间轮刻度（Duration 友好写法：100ms、1s） */
        private Duration tickDuration = Duration.ofMillis(100);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数） */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public Destinations getDestinations() { return destinations; }
    public void setDestinations(Destinations destinations) { this.destinations = destinations; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Workers getWorkers() { return workers; }
    public void setWorkers(Workers workers) { this.workers = workers; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    public DeadLetter getDeadLetter() { return deadLetter; }
    public void setDeadLetter(DeadLetter deadLetter) { this.deadLetter = deadLetter; }

    public Transform getTransform() { return transform; }
    public void setTransform(Transform transform) { this.transform = transform; }

    public BrokerCfg getBroker() { return broker; }
    public void setBroker(BrokerCfg broker) { this.broker = broker; }

    // ----------------- 便捷换算 -----------------

    /** 构建只读重试策略, 参数非法时抛 IllegalArgumentException */
    public RetryPolicy toRetryPolicy() {
        return RetryPolicy.builder()
                .maxRetries(retry.getMaxRetries())
                .initialInterval(retry.getInitialInterval())
                .maxInterval(retry.getMaxInterval())
                .multiplier(retry.getMultiplier())
                .jitterFactor(retry.getJitterFactor())
                .strategy(retry.getStrategy())
                .build();
    }
}
