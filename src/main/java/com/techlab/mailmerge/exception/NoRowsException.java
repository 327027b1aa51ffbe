package com.techlab.mailmerge.exception;

import org.springframework.http.HttpStatus;

/** The batch has nothing to render once the filter is applied. Raised before any render call. */
public class NoRowsException extends MailMergeException {

    public NoRowsException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }
}
