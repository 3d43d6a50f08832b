package com.example.mlrundb.encode;

import com.example.mlrundb.error.FormatException;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decodes JSON documents into envelope types. Property names match case-insensitively,
 * unknown properties are ignored and JSON {@code null} leaves a field at its sentinel.
 *
 * <p>Indexing is best effort: a value whose shape does not fit its envelope field (an
 * object where a string is expected, text for an integer) is dropped and the field keeps
 * its sentinel. Only a root that is not an object is rejected.
 */
@Component
public class EnvelopeReader {

    private static final Logger logger = LoggerFactory.getLogger(EnvelopeReader.class);

    private final ObjectMapper mapper;

    public EnvelopeReader() {
        this.mapper = JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        this.mapper.setDefaultSetterInfo(JsonSetter.Value.forValueNulls(Nulls.SKIP));
    }

    public <T extends AttributeSource> T read(JsonNode root, Class<T> type) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return newInstance(type);
        }
        if (!root.isObject()) {
            throw new FormatException("Document root must be an object, got " + root.getNodeType());
        }
        JsonNode tree = root;
        while (true) {
            try {
                return mapper.treeToValue(tree, type);
            } catch (JsonMappingException e) {
                if (tree == root) {
                    tree = root.deepCopy();
                }
                if (!drop(tree, e.getPath())) {
                    throw new FormatException("Cannot decode " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
                }
                logger.debug("Not indexing {}: {}", e.getPathReference(), e.getOriginalMessage());
            } catch (JsonProcessingException e) {
                throw new FormatException("Cannot decode " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
            }
        }
    }

    /** Removes the node at {@code path} from {@code tree}; false when there is nothing to remove. */
    private static boolean drop(JsonNode tree, List<JsonMappingException.Reference> path) {
        if (path.isEmpty()) {
            return false;
        }
        JsonNode parent = tree;
        for (int i = 0; i < path.size() - 1 && parent != null; i++) {
            parent = child(parent, path.get(i));
        }
        JsonMappingException.Reference last = path.get(path.size() - 1);
        if (parent instanceof ObjectNode object && last.getFieldName() != null) {
            return object.remove(last.getFieldName()) != null;
        }
        if (parent instanceof ArrayNode array && last.getIndex() >= 0 && last.getIndex() < array.size()) {
            array.remove(last.getIndex());
            return true;
        }
        return false;
    }

    private static JsonNode child(JsonNode node, JsonMappingException.Reference reference) {
        if (reference.getFieldName() != null) {
            return node.get(reference.getFieldName());
        }
        return reference.getIndex() >= 0 ? node.get(reference.getIndex()) : null;
    }

    private static <T> T newInstance(Class<T> type) {
        try {
            return type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Envelope type " + type.getName() + " needs a no-arg constructor", e);
        }
    }
}
