package com.example.mlrundb.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Parameters of a run or artifact listing (or delete-by-query). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListQuery {
    private String project;
    private String name;
    /** Runs only. */
    private String state;
    /** Artifacts only; null means {@code latest}, {@code *} means any. */
    private String tag;
    /** Label tokens: {@code key}, {@code key=value}, {@code key!=value} or {@code key~=value}. */
    private List<String> labels;
    /** Runs only; epoch nanoseconds, 0 for no bound. */
    private long updatedAfter;
    private boolean sort;
    /** 0 for no limit. */
    private int limit;
}
