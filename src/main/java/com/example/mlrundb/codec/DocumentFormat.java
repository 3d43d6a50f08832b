package com.example.mlrundb.codec;

import java.nio.charset.StandardCharsets;

public enum DocumentFormat {
    YAML,
    JSON;

    private static final byte[] YAML_DOCUMENT_START = "---".getBytes(StandardCharsets.US_ASCII);

    /**
     * A document starting with the YAML document separator is YAML, anything else is
     * taken to be JSON.
     */
    public static DocumentFormat detect(byte[] data) {
        if (data == null || data.length < YAML_DOCUMENT_START.length) {
            return JSON;
        }
        for (int i = 0; i < YAML_DOCUMENT_START.length; i++) {
            if (data[i] != YAML_DOCUMENT_START[i]) {
                return JSON;
            }
        }
        return YAML;
    }
}
