package com.example.mlrundb.encode;

/**
 * A record that knows which of its fields are indexable. Implementations list their
 * fields explicitly, nested sections through {@link AttributeWriter#nested}.
 */
@FunctionalInterface
public interface AttributeSource {

    void writeTo(AttributeWriter writer);
}
