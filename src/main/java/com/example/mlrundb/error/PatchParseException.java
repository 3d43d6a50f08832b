package com.example.mlrundb.error;

/** The update body is not a flat JSON object of dot-path keys, or a path cannot be applied. */
public class PatchParseException extends MetadataDbException {

    public PatchParseException(String message) {
        super(message);
    }

    public PatchParseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getStatusCode() {
        return 400;
    }

    @Override
    public String getErrorCode() {
        return "patch_error";
    }
}
