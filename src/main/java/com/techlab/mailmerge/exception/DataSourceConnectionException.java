package com.techlab.mailmerge.exception;

import org.springframework.http.HttpStatus;

/** Data source unreachable or credentials rejected. */
public class DataSourceConnectionException extends MailMergeException {

    public DataSourceConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_GATEWAY;
    }
}
