package com.techlab.mailmerge.renderer;

public class RenderTimeoutException extends RenderException {

    public RenderTimeoutException(String message) {
        super(message);
    }
}
