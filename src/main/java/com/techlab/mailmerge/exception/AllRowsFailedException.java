package com.techlab.mailmerge.exception;

import com.techlab.mailmerge.model.RowOutcome;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Every row of a batch failed to render. Distinct from a partial failure, which still succeeds.
 */
public class AllRowsFailedException extends MailMergeException {

    private final List<RowOutcome> failures;

    public AllRowsFailedException(List<RowOutcome> failures) {
        super("No document could be generated: all " + failures.size() + " rows failed");
        this.failures = List.copyOf(failures);
    }

    public List<RowOutcome> getFailures() {
        return failures;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
