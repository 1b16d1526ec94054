package com.apichain.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A flag shared between a caller and running sequences. Once cancelled, no sequence sharing the token
 * starts another step.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
