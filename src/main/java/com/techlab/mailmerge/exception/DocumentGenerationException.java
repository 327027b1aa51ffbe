package com.techlab.mailmerge.exception;

import org.springframework.http.HttpStatus;

/** A single-document request whose render failed. */
public class DocumentGenerationException extends MailMergeException {

    public DocumentGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
