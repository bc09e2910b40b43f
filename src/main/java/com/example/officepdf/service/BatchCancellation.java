package com.example.officepdf.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a running batch. Checked before each row is
 * started; a row already in progress runs to completion.
 */
public class BatchCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
