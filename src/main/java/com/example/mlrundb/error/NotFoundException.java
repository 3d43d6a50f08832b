package com.example.mlrundb.error;

/** The backend has no item (or directory) at the requested path. */
public class NotFoundException extends MetadataDbException {

    public NotFoundException(String path) {
        super("Not found: " + path);
    }

    @Override
    public int getStatusCode() {
        return 404;
    }

    @Override
    public String getErrorCode() {
        return "not_found";
    }
}
