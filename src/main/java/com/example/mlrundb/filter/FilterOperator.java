package com.example.mlrundb.filter;

public enum FilterOperator {
    EQ,
    NE,
    GT,
    GE,
    LT,
    LE,
    CONTAINS,
    STARTS,
    ENDS,
    EXISTS
}
