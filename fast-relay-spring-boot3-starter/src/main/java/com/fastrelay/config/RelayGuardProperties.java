package com.fastrelay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * relay:
 *   guard:
 *     enabled: true
 *     circuit-breaker:
 *       failure-threshold: 5
 *       reset-timeout: 30s
 *     cb-per-handler:
 *       payment-api: { failure-threshold: 3, reset-timeout: 5s }
 */
@Data
@ConfigurationProperties(prefix = "relay.guard")
public class RelayGuardProperties {
    /** 开关 */
    private boolean enabled = true;

    /** 默认配置（可被 handler 覆盖） */
    private CbConfig circuitBreaker = new CbConfig();

    /** 按 handler 名称覆盖 */
    private Map<String, CbConfig> cbPerHandler;

    @Data
    public static class CbConfig {
        private boolean enabled = true;
        /** 连续失败多少次打开 */
        private int failureThreshold = 5;
        /** 打开后多久允许一次试探 */
        private Duration resetTimeout = Duration.ofSeconds(30);
    }
}
