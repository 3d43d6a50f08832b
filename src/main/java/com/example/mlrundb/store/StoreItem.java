package com.example.mlrundb.store;

import com.example.mlrundb.encode.AttributeNames;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/** Attributes of one backend item, as returned by a get or a query. */
public final class StoreItem {

    private final Map<String, Object> attributes;

    public StoreItem(Map<String, Object> attributes) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Optional<String> getString(String attribute) {
        Object value = attributes.get(attribute);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /** Integral value of the attribute; empty when missing or not an integer. */
    public OptionalLong getLong(String attribute) {
        Object value = attributes.get(attribute);
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return OptionalLong.of(((Number) value).longValue());
        }
        return OptionalLong.empty();
    }

    public Optional<byte[]> getBytes(String attribute) {
        Object value = attributes.get(attribute);
        if (value instanceof byte[] bytes) {
            return Optional.of(bytes);
        }
        if (value instanceof String s) {
            return Optional.of(s.getBytes(StandardCharsets.UTF_8));
        }
        return Optional.empty();
    }

    /** Name of the item within its directory. */
    public Optional<String> getName() {
        return getString(AttributeNames.ITEM_NAME);
    }

    /** The stored document; empty for items written without one. */
    public Optional<byte[]> getData() {
        return getBytes(AttributeNames.DATA);
    }
}
