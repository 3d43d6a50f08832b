package com.example.mlrundb.codec;

import com.example.mlrundb.error.FormatException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Converts stored documents between YAML and JSON. JSON input passes through untouched;
 * YAML output keeps the {@code ---} start marker so it is detected as YAML again.
 */
@Component
public class DocumentCodec {

    private static final Logger logger = LoggerFactory.getLogger(DocumentCodec.class);

    private final ObjectMapper yamlMapper =
            new ObjectMapper(new YAMLFactory().enable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public DocumentFormat detect(byte[] data) {
        return DocumentFormat.detect(data);
    }

    public byte[] toJson(byte[] data) {
        if (detect(data) == DocumentFormat.JSON) {
            return data;
        }
        try {
            JsonNode tree = yamlMapper.readTree(data);
            if (tree == null || tree.isMissingNode()) {
                tree = NullNode.getInstance();
            }
            return jsonMapper.writeValueAsBytes(tree);
        } catch (IOException e) {
            logger.warn("Failed to convert YAML to JSON: {}", e.getMessage());
            throw new FormatException("Malformed YAML document: " + e.getMessage(), e);
        }
    }

    /** Reads {@code data} (YAML or JSON) as a JSON tree. */
    public JsonNode readTree(byte[] data) {
        try {
            JsonNode tree = jsonMapper.readTree(toJson(data));
            return tree == null || tree.isMissingNode() ? NullNode.getInstance() : tree;
        } catch (IOException e) {
            throw new FormatException("Malformed JSON document: " + e.getMessage(), e);
        }
    }

    public byte[] fromJson(byte[] json, DocumentFormat format) {
        if (format == DocumentFormat.JSON) {
            return json;
        }
        try {
            return yamlMapper.writeValueAsBytes(jsonMapper.readTree(json));
        } catch (IOException e) {
            throw new FormatException("Cannot render document as YAML: " + e.getMessage(), e);
        }
    }
}
