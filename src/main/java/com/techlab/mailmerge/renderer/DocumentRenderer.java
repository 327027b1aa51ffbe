package com.techlab.mailmerge.renderer;

import com.techlab.mailmerge.model.RenderRequest;

/**
 * Turns a resolved render request into PDF bytes.
 *
 * <p>Callers hold a render slot for the duration of each call, so at most
 * {@code mailmerge.batch.worker-count} calls run at once. Implementations must not share per-call
 * state between concurrent calls.
 */
public interface DocumentRenderer {

    byte[] render(RenderRequest request) throws RenderException;
}
