package com.example.mlrundb.controller;

import com.example.mlrundb.encode.Timestamps;
import com.example.mlrundb.error.FormatException;

/** Parsing of optional query parameters shared by the listing endpoints. */
final class QueryParams {

    private QueryParams() {
    }

    /** Absent means {@code defaultLimit}; anything that is not a non-negative integer is rejected. */
    static int limit(String value, int defaultLimit) {
        if (value == null || value.isEmpty()) {
            return defaultLimit;
        }
        int limit;
        try {
            limit = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new FormatException("Parameter 'last' must be an integer, got '" + value + "'", e);
        }
        if (limit < 0) {
            throw new FormatException("Parameter 'last' must not be negative, got " + limit);
        }
        return limit;
    }

    static boolean flag(String value) {
        return Boolean.parseBoolean(value);
    }

    /** Epoch nanoseconds of a {@code yyyy-MM-dd HH:mm:ss.SSSSSS} timestamp; 0 when absent. */
    static long timestamp(String name, String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        return Timestamps.toEpochNanos(value)
                .orElseThrow(() -> new FormatException("Parameter '" + name + "' must look like 2019-01-31 12:00:00.000000"));
    }
}
