package com.fastrelay.core.notify.notifier;

import com.fastrelay.core.spi.notify.Notifier;
import com.fastrelay.model.ctx.NotifyContext;
import com.fastrelay.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 默认通知渠道: 写日志
 * 死信与发布失败带上错误描述, 其余事件只输出定位字段
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    private final int lastErrorMaxLength;

    public LoggingNotifier() {
        this(2000);
    }

    public LoggingNotifier(int lastErrorMaxLength) {
        this.lastErrorMaxLength = Math.max(0, lastErrorMaxLength);
    }

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotifyContext ctx, Severity severity) {
        String line = render(ctx);
        switch (severity) {
            case CRITICAL, ERROR -> log.error(line);
            case WARNING -> log.warn(line);
            default -> log.info(line);
        }
    }

    String render(NotifyContext ctx) {
        StringBuilder sb = new StringBuilder(128)
                .append("[Relay-Notify-").append(ctx.getType()).append("] node=").append(ctx.getNodeId());
        append(sb, "handler", ctx.getHandler());
        append(sb, "dest", ctx.getDestination());
        append(sb, "record", ctx.getRecordId());
        if (ctx.getAttempt() != null) {
            sb.append(", attempt=").append(ctx.getAttempt());
            if (ctx.getMaxRetries() != null) {
                sb.append('/').append(ctx.getMaxRetries());
            }
        }
        append(sb, "reason", ctx.getReasonCode());
        if (!ctx.getAttributes().isEmpty()) {
            sb.append(", attrs=").append(ctx.getAttributes());
        }
        String err = ctx.getLastError();
        if (err != null && lastErrorMaxLength > 0) {
            sb.append(", err=").append(err.length() > lastErrorMaxLength ? err.substring(0, lastErrorMaxLength) : err);
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, String name, String value) {
        if (value != null) {
            sb.append(", ").append(name).append('=').append(value);
        }
    }
}
