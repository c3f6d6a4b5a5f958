package com.series.writer.service.pipeline;

import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot shutdown signal shared by every background task of a pipeline.
 *
 * Waits go through {@link #awaitCancellation(long)} instead of Thread.sleep so that a
 * shutdown wakes interval sleeps and retry backoffs immediately.
 */
@Component
public class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits until the signal fires or the timeout elapses.
     *
     * An interrupt is treated as cancellation; the interrupt flag is restored.
     *
     * @param timeoutMs maximum wait in milliseconds
     * @return true if cancelled, false if the full timeout elapsed
     */
    public boolean awaitCancellation(long timeoutMs) {
        try {
            return latch.await(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
