package com.techlab.mailmerge.renderer;

public class InvalidMarkupException extends RenderException {

    public InvalidMarkupException(String message, Throwable cause) {
        super(message, cause);
    }
}
