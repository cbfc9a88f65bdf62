package com.cataphract.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured record emitted by an order handler, e.g. a capture or a pillage.
 */
public record OrderEvent(String type, Map<String, Object> attributes) {

    public OrderEvent {
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static OrderEvent of(String type, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("event attributes must be key/value pairs");
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            attributes.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new OrderEvent(type, attributes);
    }

    public Object get(String key) {
        return attributes.get(key);
    }
}
