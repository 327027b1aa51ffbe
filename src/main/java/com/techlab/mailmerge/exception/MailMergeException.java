package com.techlab.mailmerge.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures that reach the caller. Each subtype knows the HTTP status it maps to.
 */
public abstract class MailMergeException extends RuntimeException {

    protected MailMergeException(String message) {
        super(message);
    }

    protected MailMergeException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus getStatus();
}
