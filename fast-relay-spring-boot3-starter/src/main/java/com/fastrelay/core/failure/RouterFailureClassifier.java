package com.fastrelay.core.failure;

import com.fastrelay.core.spi.failure.FailureCaseHandler;
import com.fastrelay.core.spi.failure.FailureClassifier;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 按 cause 链路由到最匹配的 FailureCaseHandler
 */
public class RouterFailureClassifier implements FailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    private final List<FailureCaseHandler<?>> handlers;

    /** 未匹配时的默认分类 */
    private final Classification defaultClassification;

    public RouterFailureClassifier(List<FailureCaseHandler<?>> handlers) {
        this(handlers, null);
    }

    public RouterFailureClassifier(List<FailureCaseHandler<?>> handlers, Classification defaultClassification) {
        this.handlers = handlers == null ? List.of() : handlers.stream().distinct().collect(Collectors.toList());
        this.defaultClassification = defaultClassification;
    }

    /**
     * 先本体再逐级 cause, 同层多个匹配时选择离异常类最近的处理器
     * Throwable 兜底处理器只在整条链都没有具体匹配时作用于本体
     */
    @Override
    public Classification classify(Throwable t) {
        int depth = 0;
        for (Throwable e = t; e != null && depth < MAX_CAUSE_DEPTH; e = e.getCause(), depth++) {
            FailureCaseHandler<?> matched = findBestHandler(e, false);
            if (matched != null) {
                return safeCall(matched, e);
            }
        }
        if (t != null) {
            FailureCaseHandler<?> fallback = findBestHandler(t, true);
            if (fallback != null) {
                return safeCall(fallback, t);
            }
        }
        if (defaultClassification != null) {
            return defaultClassification;
        }
        return Classification.transientFailure(t == null ? "unknown" : t.getClass().getSimpleName());
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Classification safeCall(FailureCaseHandler h, Throwable e) {
        return h.classify(e);
    }

    private FailureCaseHandler<?> findBestHandler(Throwable e, boolean includeCatchAll) {
        return handlers.stream()
                .filter(h -> includeCatchAll || !Throwable.class.equals(h.exceptionType()))
                .filter(h -> h.supports(e))
                .min(Comparator.comparingInt(h -> distance(e.getClass(), h.exceptionType())))
                .orElse(null);
    }

    private static int distance(Class<?> from, Class<?> to) {
        // from 向上继承到 to 的层数
        int d = 0;
        Class<?> c = from;
        while (c != null && !to.equals(c)) {
            c = c.getSuperclass();
            ++d;
        }
        return (c == null) ? Integer.MAX_VALUE : d;
    }
}
