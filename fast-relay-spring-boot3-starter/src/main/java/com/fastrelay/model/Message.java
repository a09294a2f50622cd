package com.fastrelay.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 消息: 不透明负载 + 有序属性表
 * 不可变, 所有修改都返回新实例
 */
public final class Message {

    private final byte[] payload;

    /** 保留插入顺序, key 唯一 */
    private final Map<String, String> attributes;

    public Message(byte[] payload, Map<String, String> attributes) {
        this.payload = payload == null ? new byte[0] : payload.clone();
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Message of(byte[] payload) {
        return new Message(payload, null);
    }

    public static Message of(String payload) {
        return new Message(payload.getBytes(StandardCharsets.UTF_8), null);
    }

    public static Message of(String payload, Map<String, String> attributes) {
        return new Message(payload.getBytes(StandardCharsets.UTF_8), attributes);
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public String getPayloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public Message withPayload(byte[] newPayload) {
        return new Message(newPayload, attributes);
    }

    /**
     * 覆盖/追加属性, 已存在的 key 保持原位置
     */
    public Message withAttributes(Map<String, String> updates) {
        Map<String, String> merged = new LinkedHashMap<>(attributes);
        merged.putAll(updates);
        return new Message(payload, merged);
    }

    public Message withAttribute(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(attributes);
        merged.put(key, value);
        return new Message(payload, merged);
    }

    public Message withoutAttributes(Collection<String> keys) {
        Map<String, String> kept = new LinkedHashMap<>(attributes);
        keys.forEach(kept::remove);
        return new Message(payload, kept);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message other)) return false;
        return Arrays.equals(payload, other.payload) && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(payload) + Objects.hashCode(attributes);
    }

    @Override
    public String toString() {
        return "Message{payloadBytes=" + payload.length + ", attributes=" + attributes + "}";
    }
}
