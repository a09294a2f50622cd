package com.fastrelay.core.transform;

import com.fastrelay.core.metric.RelayMetrics;
import com.fastrelay.core.spi.PayloadTransformer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 错误分类 → 纠正性转换
 * - 精确匹配错误分类, 未命中走默认转换（默认 identity）
 * - 转换失败返回原负载, 只记日志和指标, 不向上抛
 * - 线程安全
 */
@Slf4j
public class TransformationRegistry {

    public static final String IDENTITY = "identity";

    public static final String LOGGING = "logging";

    private final Map<String, PayloadTransformer> transformers = new ConcurrentHashMap<>(16);

    private final PayloadTransformer defaultTransformer;

    private final RelayMetrics metrics;

    public TransformationRegistry(PayloadTransformer defaultTransformer, RelayMetrics metrics,
                                  @Nullable List<PayloadTransformer> discovered) {
        this.defaultTransformer = defaultTransformer == null ? new IdentityTransformer() : defaultTransformer;
        this.metrics = metrics;
        if (discovered != null) {
            discovered.forEach(t -> t.errorClasses().forEach(ec -> register(ec, t)));
        }
    }

    public TransformationRegistry(PayloadTransformer defaultTransformer, RelayMetrics metrics) {
        this(defaultTransformer, metrics, null);
    }

    public TransformationRegistry() {
        this(new IdentityTransformer(), RelayMetrics.simple());
    }

    /**
     * 按名称构造默认转换: identity | logging
     */
    public static PayloadTransformer defaultFor(String name) {
        if (LOGGING.equalsIgnoreCase(name == null ? "" : name.trim())) {
            return new LoggingNoopTransformer();
        }
        return new IdentityTransformer();
    }

    /**
     * 注册或覆盖
     */
    public TransformationRegistry register(String errorClass, PayloadTransformer transformer) {
        if (errorClass == null || errorClass.isBlank()) {
            throw new IllegalArgumentException("errorClass must not be blank");
        }
        transformers.put(errorClass, transformer);
        log.info("[Relay-Transform] registered transformer for errorClass={}", errorClass);
        return this;
    }

    public byte[] apply(String errorClass, byte[] payload, Throwable error) {
        PayloadTransformer t = errorClass == null ? null : transformers.get(errorClass);
        if (t == null) {
            t = defaultTransformer;
        }
        try {
            byte[] out = t.transform(payload, error);
            return out == null ? payload : out;
        } catch (Throwable e) {
            // 包括 StackOverflowError 等, 转换失败只影响负载不影响重试
            metrics.incTransformFailed();
            log.warn("[Relay-Transform] transformer failed for errorClass={}, retry with original payload: {}",
                    errorClass, e.toString());
            return payload;
        }
    }

    public Set<String> errorClasses() {
        return Collections.unmodifiableSet(transformers.keySet());
    }
}
