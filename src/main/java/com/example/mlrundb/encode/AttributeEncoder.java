package com.example.mlrundb.encode;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens an envelope into the attribute map stored next to the document.
 *
 * <p>Only fields that were present in the decoded document are emitted; see
 * {@link Sentinels}. String fields that hold a run timestamp additionally produce
 * a {@code <name>Epoch} attribute in nanoseconds, which is what time filters and
 * listing order work on.
 */
@Component
public class AttributeEncoder {

    public Map<String, Object> flatten(AttributeSource source) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        flattenInto(source, attributes);
        return attributes;
    }

    /** Adds the attributes of {@code source} to {@code target}, overwriting equal names. */
    public void flattenInto(AttributeSource source, Map<String, Object> target) {
        source.writeTo(new AttributeWriter("", target));
    }
}
