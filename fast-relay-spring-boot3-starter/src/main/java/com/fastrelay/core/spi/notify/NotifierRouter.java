package com.fastrelay.core.spi.notify;

import com.fastrelay.model.ctx.NotifyContext;
import com.fastrelay.model.enums.Severity;

import java.util.List;

/**
 * 为一条事件挑选投递渠道
 */
@FunctionalInterface
public interface NotifierRouter {

    List<Notifier> route(NotifyContext ctx, Severity severity);
}
