package com.fastrelay.core.spi.notify;

import com.fastrelay.model.ctx.NotifyContext;
import com.fastrelay.model.enums.Severity;

/**
 * 派发前过滤, 任一 filter 拒绝即抑制该事件并计数
 */
@FunctionalInterface
public interface NotifierFilter {

    boolean allow(NotifyContext ctx, Severity severity);
}
