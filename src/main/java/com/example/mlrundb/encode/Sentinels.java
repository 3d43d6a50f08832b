package com.example.mlrundb.encode;

/**
 * Placeholder values an envelope field holds until decoding assigns it. A field that
 * still holds its placeholder after decoding was absent from the document and emits
 * no attribute.
 */
public final class Sentinels {

    public static final String INVALID_STRING = "?invalid";
    public static final long INVALID_INT = 0xBADACAFEL;
    public static final double INVALID_FLOAT = Double.POSITIVE_INFINITY;

    private Sentinels() {
    }

    public static boolean isInvalid(String value) {
        return INVALID_STRING.equals(value);
    }

    public static boolean isInvalid(long value) {
        return value == INVALID_INT;
    }

    public static boolean isInvalid(double value) {
        return value == INVALID_FLOAT;
    }
}
