package com.techlab.mailmerge.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.concurrent.Semaphore;

/**
 * Bounds the number of renders in flight across the whole application, batch rows and single
 * documents alike. One permit per worker, handed out in arrival order.
 */
@Component
public class RenderSlots {

    private final Semaphore slots;
    private final int capacity;

    public RenderSlots(@Value("${mailmerge.batch.worker-count:2}") int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("mailmerge.batch.worker-count must be at least 1");
        }
        this.capacity = workerCount;
        this.slots = new Semaphore(workerCount, true);
    }

    /**
     * Blocks until a slot is free. An interrupted wait gives up with a {@link CancellationException}.
     */
    public void acquire() {
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Render interrupted while waiting for a slot");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    public void release() {
        slots.release();
    }

    public int capacity() {
        return capacity;
    }

    public int available() {
        return slots.availablePermits();
    }
}
