package com.techlab.mailmerge.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RenderSlotsTest {

    @Test
    public void testWorkerCountMustBePositive() {
        assertThatThrownBy(() -> new RenderSlots(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mailmerge.batch.worker-count");
    }

    @Test
    public void testAcquireAndRelease() {
        RenderSlots slots = new RenderSlots(2);

        slots.acquire();
        assertThat(slots.available()).isEqualTo(1);
        slots.release();
        assertThat(slots.available()).isEqualTo(2);
        assertThat(slots.capacity()).isEqualTo(2);
    }

    @Test
    public void testInterruptedWaitIsCancelled() throws Exception {
        RenderSlots slots = new RenderSlots(1);
        slots.acquire();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread waiter = new Thread(() -> {
            try {
                slots.acquire();
            } catch (Throwable e) {
                failure.set(e);
            } finally {
                done.countDown();
            }
        });
        waiter.start();
        waiter.interrupt();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(failure.get()).isInstanceOf(CancellationException.class)
                .hasCauseInstanceOf(InterruptedException.class);
        assertThat(slots.available()).isZero();
    }
}
