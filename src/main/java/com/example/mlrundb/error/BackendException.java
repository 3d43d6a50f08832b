package com.example.mlrundb.error;

/**
 * Any backend failure other than a missing path. The status code is the backend's own,
 * passed to the HTTP caller verbatim.
 */
public class BackendException extends MetadataDbException {

    private final int statusCode;

    public BackendException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public BackendException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    @Override
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public String getErrorCode() {
        return "backend_error";
    }
}
