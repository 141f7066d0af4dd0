package com.ttennebkram.imagefilter.engine;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;

/**
 * The estimated working set of a chain exceeds the configured memory ceiling.
 * Raised before any stage runs; {@link #getSuggestedScale()} tells the caller how
 * far to downscale the source for the chain to fit.
 */
public class MemoryBudgetExceededException extends AllocationFailureException {

    public MemoryBudgetExceededException(long estimatedBytes, long ceilingBytes) {
        super("Chain needs an estimated " + estimatedBytes + " bytes, ceiling is " + ceilingBytes,
                estimatedBytes, ceilingBytes);
    }

    public long getEstimatedBytes() {
        return getRequestedBytes();
    }

    public long getCeilingBytes() {
        return getAvailableBytes();
    }
}
