package com.fastrelay.core.transform;

import com.fastrelay.core.spi.PayloadTransformer;

public class IdentityTransformer implements PayloadTransformer {
    @Override
    public byte[] transform(byte[] payload, Throwable error) {
        return payload;
    }
}
