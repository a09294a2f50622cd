package com.fastrelay.core.spi.notify;

import com.fastrelay.model.ctx.NotifyContext;
import com.fastrelay.model.enums.NotifyEventType;
import com.fastrelay.model.enums.Severity;

import java.util.EnumSet;
import java.util.Set;

/**
 * 告警渠道（死信、死信堆积、熔断打开、发布失败等）
 * 应用注册为 Bean 即自动接入
 */
public interface Notifier {

    /** 渠道名, 用于日志 */
    String name();

    /** 订阅的事件类型, 默认全部 */
    default Set<NotifyEventType> events() {
        return EnumSet.allOf(NotifyEventType.class);
    }

    /** 该渠道接收的最低级别 */
    default Severity minSeverity() {
        return Severity.INFO;
    }

    default boolean supports(NotifyContext ctx) {
        return events().contains(ctx.getType());
    }

    /**
     * 同步投递, 由通知线程池调用; 抛出运行时异常会被重试
     */
    void notify(NotifyContext ctx, Severity severity);
}
