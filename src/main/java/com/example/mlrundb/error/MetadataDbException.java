package com.example.mlrundb.error;

/**
 * Base class of every failure the metadata service reports to its callers.
 * Each subclass carries the HTTP status the request should end with.
 */
public abstract class MetadataDbException extends RuntimeException {

    protected MetadataDbException(String message) {
        super(message);
    }

    protected MetadataDbException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract int getStatusCode();

    /** Short machine-readable error kind, e.g. {@code format_error}. */
    public abstract String getErrorCode();
}
