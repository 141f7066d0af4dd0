package com.ttennebkram.imagefilter.engine;

/**
 * Cooperative cancellation flag checked by the executor before every stage.
 */
public class CancellationSignal {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws ChainCancelledException if cancelled or the current thread was interrupted
     */
    public void throwIfCancelled(String context) {
        if (cancelled || Thread.currentThread().isInterrupted()) {
            throw new ChainCancelledException("Cancelled " + context);
        }
    }
}
