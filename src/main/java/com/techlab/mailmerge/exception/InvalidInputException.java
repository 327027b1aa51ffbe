package com.techlab.mailmerge.exception;

import org.springframework.http.HttpStatus;

/** Missing template, table or data in a request. Not retried. */
public class InvalidInputException extends MailMergeException {

    public InvalidInputException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}
