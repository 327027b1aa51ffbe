package com.techlab.mailmerge.model;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a batch: one entry per filtered row, in input order, plus the ZIP archive holding
 * every successful document.
 */
@Value
public class BatchResult {
    List<RowOutcome> outcomes;
    int totalCount;
    byte[] archive;

    public int getFilteredCount() {
        return outcomes.size();
    }

    public long getSucceededCount() {
        return outcomes.stream().filter(RowOutcome::isSuccess).count();
    }

    public List<RowOutcome> getFailures() {
        return outcomes.stream().filter(outcome -> !outcome.isSuccess()).collect(Collectors.toList());
    }
}
