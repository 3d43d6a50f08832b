package com.example.mlrundb.encode;

import java.util.regex.Pattern;

/**
 * Attribute naming shared by the encoder and the filter builder, so that names written
 * on store and names referenced in filters always agree.
 */
public final class AttributeNames {

    private static final Pattern ILLEGAL = Pattern.compile("[^a-zA-Z0-9_]");

    /** Raw document bytes. */
    public static final String DATA = "_data_";
    /** Last path segment, maintained by the store. */
    public static final String ITEM_NAME = "__name";
    public static final String EPOCH_SUFFIX = "Epoch";

    public static final String RUN_NAME = sanitize("metadata.name");
    public static final String RUN_STATE = sanitize("status.state");
    public static final String RUN_LAST_UPDATE_EPOCH = sanitize("status.lasttime" + EPOCH_SUFFIX);
    public static final String ARTIFACT_NAME = sanitize("name");

    private AttributeNames() {
    }

    /** Replaces every character other than a letter, digit or underscore with {@code _}. */
    public static String sanitize(String name) {
        return ILLEGAL.matcher(name).replaceAll("_");
    }
}
