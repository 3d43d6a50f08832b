package com.example.mlrundb.error;

/** Malformed YAML/JSON document or request parameter. */
public class FormatException extends MetadataDbException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getStatusCode() {
        return 400;
    }

    @Override
    public String getErrorCode() {
        return "format_error";
    }
}
