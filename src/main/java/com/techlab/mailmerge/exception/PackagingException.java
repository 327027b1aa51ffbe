package com.techlab.mailmerge.exception;

import org.springframework.http.HttpStatus;

/** The batch archive could not be built. No partial archive is returned. */
public class PackagingException extends MailMergeException {

    public PackagingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
