package com.fastrelay.core.transform;

import com.fastrelay.core.spi.PayloadTransformer;
import lombok.extern.slf4j.Slf4j;

/**
 * 负载不变, 仅记录一次未匹配的错误分类
 */
@Slf4j
public class LoggingNoopTransformer implements PayloadTransformer {
    @Override
    public byte[] transform(byte[] payload, Throwable error) {
        log.info("[Relay-Transform] no transformer matched, payloadBytes={}, error={}",
                payload == null ? 0 : payload.length, error == null ? "null" : error.toString());
        return payload;
    }
}
