package com.example.mlrundb.error;

public class FilterSyntaxException extends MetadataDbException {

    public FilterSyntaxException(String message, int position) {
        super(message + " at position " + position);
    }

    @Override
    public int getStatusCode() {
        return 400;
    }

    @Override
    public String getErrorCode() {
        return "filter_error";
    }
}
