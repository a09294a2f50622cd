package com.fastrelay.core.notify;

import com.fastrelay.model.ctx.NotifyContext;
import com.fastrelay.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;

import java.util.function.Supplier;

/**
 * 路由/死信/熔断等组件的统一告警入口
 * 通知关闭时为空操作, 通知本身的异常不影响消息处理
 */
public class NotifyingFacade {

    private static final Logger log = LoggerFactory.getLogger(NotifyingFacade.class);

    private final Supplier<AsyncNotifyingService> delegate;

    public NotifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        this.delegate = provider::getIfAvailable;
    }

    public NotifyingFacade(Supplier<AsyncNotifyingService> delegate) {
        this.delegate = delegate;
    }

    public static NotifyingFacade disabled() {
        return new NotifyingFacade(() -> null);
    }

    public static NotifyingFacade of(AsyncNotifyingService service) {
        return new NotifyingFacade(() -> service);
    }

    public boolean isEnabled() {
        return delegate.get() != null;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        AsyncNotifyingService s = delegate.get();
        if (s == null) {
            return;
        }
        try {
            s.fire(ctx, sev);
        } catch (RuntimeException e) {
            log.warn("[Relay-Notify] event={} not dispatched: {}", ctx.getType(), e.toString());
        }
    }
}
