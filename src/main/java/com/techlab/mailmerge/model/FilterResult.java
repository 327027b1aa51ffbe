package com.techlab.mailmerge.model;

import lombok.Value;

import java.util.List;

@Value
public class FilterResult {
    List<Row> rows;
    int totalCount;
    int filteredCount;
}
