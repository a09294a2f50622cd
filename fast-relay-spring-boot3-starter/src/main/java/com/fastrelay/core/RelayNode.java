package com.fastrelay.core;

import java.util.UUID;

/**
 * 当前节点标识, 用于日志和通知
 */
public final class RelayNode {

    private final String id;

    public RelayNode(String id) {
        this.id = id;
    }

    public static RelayNode of(String applicationName) {
        String app = applicationName == null || applicationName.isBlank() ? "relay" : applicationName;
        return new RelayNode(app + "-" + UUID.randomUUID());
    }

    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
