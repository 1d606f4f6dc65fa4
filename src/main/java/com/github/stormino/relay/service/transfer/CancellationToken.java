package com.github.stormino.relay.service.transfer;

import com.github.stormino.relay.exception.TransferCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one transfer run. The executor polls it between chunk reads.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return true if this call flipped the token, false if it was already cancelled
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String taskId) {
        if (cancelled.get()) {
            throw new TransferCancelledException(taskId);
        }
    }
}
