package com.fastrelay.core.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fastrelay.core.spi.PayloadTransformer;

import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * JSON 对象负载的修改助手
 * 负载不是 JSON 对象时抛异常, 由 TransformationRegistry 退回原负载
 *
 * <pre>
 * new JsonPayloadTransformer(mapper, Set.of("schema_version"),
 *         (node, err) -> node.put("v", node.path("v").asInt() + 1));
 * </pre>
 */
public class JsonPayloadTransformer implements PayloadTransformer {

    private final ObjectMapper mapper;

    private final Set<String> errorClasses;

    private final BiConsumer<ObjectNode, Throwable> mutator;

    public JsonPayloadTransformer(ObjectMapper mapper, Set<String> errorClasses,
                                  BiConsumer<ObjectNode, Throwable> mutator) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.errorClasses = errorClasses == null ? Set.of() : Set.copyOf(errorClasses);
        this.mutator = Objects.requireNonNull(mutator, "mutator");
    }

    public JsonPayloadTransformer(Set<String> errorClasses, BiConsumer<ObjectNode, Throwable> mutator) {
        this(new ObjectMapper(), errorClasses, mutator);
    }

    @Override
    public byte[] transform(byte[] payload, Throwable error) throws Exception {
        JsonNode root = mapper.readTree(payload);
        if (!(root instanceof ObjectNode obj)) {
            throw new IllegalArgumentException("payload is not a JSON object");
        }
        mutator.accept(obj, error);
        return mapper.writeValueAsBytes(obj);
    }

    @Override
    public Set<String> errorClasses() {
        return errorClasses;
    }
}
