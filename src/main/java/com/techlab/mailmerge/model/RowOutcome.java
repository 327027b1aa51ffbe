package com.techlab.mailmerge.model;

import lombok.Value;

/**
 * Result of rendering one row of a batch: either the PDF bytes or the failure reason.
 */
@Value
public class RowOutcome {
    int rowIndex;
    String filename;
    byte[] content;
    String failureReason;

    public static RowOutcome success(int rowIndex, String filename, byte[] content) {
        return new RowOutcome(rowIndex, filename, content, null);
    }

    public static RowOutcome failure(int rowIndex, String filename, String reason) {
        return new RowOutcome(rowIndex, filename, null, reason != null ? reason : "unknown error");
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
