package com.example.mlrundb.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised after a delete-by-query pass in which some items could not be deleted.
 * Items deleted before or after a failure stay deleted.
 */
public class BatchDeleteException extends MetadataDbException {

    private final Map<String, MetadataDbException> failures;
    private final int deleted;

    public BatchDeleteException(Map<String, MetadataDbException> failures, int deleted) {
        super(failures.size() + " item(s) could not be deleted, " + deleted + " deleted: " + failures.keySet());
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.deleted = deleted;
        failures.values().forEach(this::addSuppressed);
    }

    /** Failed paths in deletion order. */
    public Map<String, MetadataDbException> getFailures() {
        return failures;
    }

    public int getDeleted() {
        return deleted;
    }

    @Override
    public int getStatusCode() {
        return failures.values().iterator().next().getStatusCode();
    }

    @Override
    public String getErrorCode() {
        return "batch_delete_error";
    }
}
