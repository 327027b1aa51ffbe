package com.techlab.mailmerge.renderer;

/**
 * Failure to render one document. Recoverable: a batch records it against the row and carries on.
 */
public abstract class RenderException extends Exception {

    protected RenderException(String message) {
        super(message);
    }

    protected RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
