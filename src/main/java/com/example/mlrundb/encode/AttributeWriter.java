package com.example.mlrundb.encode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Receives the fields of an {@link AttributeSource} and stores them as flat, sanitized
 * attributes. Field names are joined to the enclosing section with a dot before
 * sanitizing, so {@code status.state} becomes {@code status_state}.
 */
public final class AttributeWriter {

    private static final Logger logger = LoggerFactory.getLogger(AttributeWriter.class);

    private final String prefix;
    private final Map<String, Object> target;

    AttributeWriter(String prefix, Map<String, Object> target) {
        this.prefix = prefix;
        this.target = target;
    }

    public void string(String field, String value) {
        if (value == null || Sentinels.isInvalid(value)) {
            return;
        }
        String name = prefix + field;
        target.put(AttributeNames.sanitize(name), value);
        Timestamps.toEpochNanos(value)
                .ifPresent(epoch -> target.put(AttributeNames.sanitize(name + AttributeNames.EPOCH_SUFFIX), epoch));
    }

    public void integer(String field, long value) {
        if (!Sentinels.isInvalid(value)) {
            target.put(AttributeNames.sanitize(prefix + field), value);
        }
    }

    private void decimal(String field, double value) {
        if (!Sentinels.isInvalid(value)) {
            target.put(AttributeNames.sanitize(prefix + field), value);
        }
    }

    private void bool(String field, boolean value) {
        target.put(AttributeNames.sanitize(prefix + field), value);
    }

    /**
     * One attribute per entry, named {@code field.key}. Entries that are not scalars are
     * skipped.
     */
    public void labels(String field, Map<String, ?> labels) {
        if (labels == null) {
            return;
        }
        labels.forEach((key, value) -> value(field + "." + key, value));
    }

    public void nested(String field, AttributeSource section) {
        if (section != null) {
            section.writeTo(new AttributeWriter(prefix + field + ".", target));
        }
    }

    /** Scalar label value; label strings are stored as they are, without an epoch twin. */
    private void value(String field, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof String) {
            target.put(AttributeNames.sanitize(prefix + field), value);
        } else if (value instanceof Double || value instanceof Float) {
            decimal(field, ((Number) value).doubleValue());
        } else if (value instanceof Number n) {
            integer(field, n.longValue());
        } else if (value instanceof Boolean b) {
            bool(field, b);
        } else {
            logger.debug("Skipping attribute {}{}: unsupported type {}", prefix, field, value.getClass().getName());
        }
    }
}
