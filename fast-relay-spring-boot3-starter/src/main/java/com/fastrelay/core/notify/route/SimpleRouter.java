package com.fastrelay.core.notify.route;

import com.fastrelay.core.spi.notify.Notifier;
import com.fastrelay.core.spi.notify.NotifierRouter;
import com.fastrelay.model.ctx.NotifyContext;
import com.fastrelay.model.enums.Severity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 按渠道声明的最低级别路由; 事件类型由 Notifier.supports 再筛一次
 */
public class SimpleRouter implements NotifierRouter {

    private final List<Notifier> notifiers;

    public SimpleRouter(Notifier single) {
        this(List.of(single));
    }

    public SimpleRouter(List<Notifier> notifiers) {
        this.notifiers = List.copyOf(notifiers);
    }

    @Override
    public List<Notifier> route(NotifyContext ctx, Severity severity) {
        return notifiers.stream()
                .filter(n -> severity.compareTo(n.minSeverity()) >= 0)
                .collect(Collectors.toList());
    }
}
