package com.fastrelay.core.notify;

import com.fastrelay.core.spi.notify.NotifierFilter;
import com.fastrelay.model.ctx.NotifyContext;
import com.fastrelay.model.enums.NotifyEventType;
import com.fastrelay.model.enums.Severity;

import java.util.EnumSet;
import java.util.Set;

/**
 * 级别下限 + 静默事件类型
 */
public class SeverityFilter implements NotifierFilter {

    private final Severity minSeverity;

    private final Set<NotifyEventType> muted;

    public SeverityFilter(Severity minSeverity, Set<NotifyEventType> muted) {
        this.minSeverity = minSeverity == null ? Severity.INFO : minSeverity;
        this.muted = muted == null || muted.isEmpty() ? EnumSet.noneOf(NotifyEventType.class) : EnumSet.copyOf(muted);
    }

    @Override
    public boolean allow(NotifyContext ctx, Severity severity) {
        return severity.compareTo(minSeverity) >= 0 && !muted.contains(ctx.getType());
    }
}
