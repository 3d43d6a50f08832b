package com.example.mlrundb.patch;

import com.example.mlrundb.error.PatchParseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Applies dot-path patches to JSON documents.
 *
 * <p>A patch is a JSON object such as {@code {"status.state": "completed"}}. Every key
 * is a {@link DotPath}; the value replaces whatever the document holds at that path,
 * creating intermediate objects (or arrays, for numeric segments) on the way. Paths the
 * patch does not name are left alone. Keys are applied in the order they appear in the
 * patch, so when one key is a prefix of another the later one wins.
 */
@Component
public class MergePatchEngine {

    private static final Logger logger = LoggerFactory.getLogger(MergePatchEngine.class);

    /** Upper bound on null padding inserted before an array index. */
    static final int MAX_ARRAY_GAP = 1024;

    private final ObjectMapper mapper = new ObjectMapper();

    public byte[] merge(byte[] oldJson, byte[] patchJson) {
        ObjectNode patch = parsePatch(patchJson);
        JsonNode document;
        try {
            document = oldJson == null || oldJson.length == 0 ? null : mapper.readTree(oldJson);
        } catch (IOException e) {
            throw new PatchParseException("Stored document is not valid JSON: " + e.getMessage(), e);
        }
        try {
            return mapper.writeValueAsBytes(apply(document, patch));
        } catch (IOException e) {
            throw new PatchParseException("Cannot serialize merged document: " + e.getMessage(), e);
        }
    }

    /** Parses a patch body, which must be a JSON object. */
    public ObjectNode parsePatch(byte[] patchJson) {
        JsonNode patch;
        try {
            patch = mapper.readTree(patchJson);
        } catch (IOException e) {
            throw new PatchParseException("Patch is not valid JSON: " + e.getMessage(), e);
        }
        if (patch == null || !patch.isObject()) {
            throw new PatchParseException("Patch must be a JSON object of dot-separated paths");
        }
        return (ObjectNode) patch;
    }

    /**
     * Applies {@code patch} to {@code document} in place where possible and returns the
     * resulting root. A missing or scalar root is replaced by a new object.
     */
    private JsonNode apply(JsonNode document, ObjectNode patch) {
        JsonNode root = document == null || !document.isContainerNode()
                ? JsonNodeFactory.instance.objectNode()
                : document;
        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            logger.trace("Setting {}", field.getKey());
            root = set(root, DotPath.parse(field.getKey()).getSegments(), 0, field.getValue().deepCopy());
        }
        return root;
    }

    /** The patch applied to an empty document, i.e. its keys turned into nested objects. */
    public ObjectNode expand(ObjectNode patch) {
        return (ObjectNode) apply(null, patch);
    }

    private JsonNode set(JsonNode node, List<DotPath.Segment> path, int depth, JsonNode value) {
        if (depth == path.size()) {
            return value;
        }
        DotPath.Segment segment = path.get(depth);
        if (node instanceof ArrayNode array && segment.isIndex()) {
            int index = segment.index == DotPath.Segment.APPEND ? array.size() : segment.index;
            if (index - array.size() > MAX_ARRAY_GAP) {
                throw new PatchParseException("Array index " + index + " too far past the end of the array");
            }
            while (array.size() <= index) {
                array.add(NullNode.getInstance());
            }
            array.set(index, set(array.get(index), path, depth + 1, value));
            return array;
        }
        if (node instanceof ObjectNode object) {
            object.set(segment.key, set(object.get(segment.key), path, depth + 1, value));
            return object;
        }
        JsonNode container = segment.isIndex()
                ? JsonNodeFactory.instance.arrayNode()
                : JsonNodeFactory.instance.objectNode();
        return set(container, path, depth, value);
    }
}
