package com.techlab.mailmerge.exception;

import org.springframework.http.HttpStatus;

/** I/O failure while reading or writing the template store. */
public class TemplateStorageException extends MailMergeException {

    public TemplateStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
