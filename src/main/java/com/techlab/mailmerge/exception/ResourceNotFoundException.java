package com.techlab.mailmerge.exception;

import org.springframework.http.HttpStatus;

/** Unknown table on the data source, or unknown stored template. */
public class ResourceNotFoundException extends MailMergeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }
}
