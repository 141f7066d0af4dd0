package com.ttennebkram.imagefilter.buffer;

import com.ttennebkram.imagefilter.FilterExecutionException;

/**
 * A buffer could not be allocated within the available memory.
 * Recoverable: the caller may retry at a reduced resolution.
 */
public class AllocationFailureException extends FilterExecutionException {

    private final long requestedBytes;
    private final long availableBytes;

    public AllocationFailureException(String message, long requestedBytes, long availableBytes) {
        this(message, requestedBytes, availableBytes, null);
    }

    public AllocationFailureException(String message, long requestedBytes, long availableBytes, Throwable cause) {
        super(message, cause);
        this.requestedBytes = requestedBytes;
        this.availableBytes = availableBytes;
    }

    public long getRequestedBytes() {
        return requestedBytes;
    }

    /**
     * Bytes that were available when the request failed, or -1 if unknown.
     */
    public long getAvailableBytes() {
        return availableBytes;
    }

    /**
     * Per-dimension scale factor that would bring the request within the available bytes.
     * Returns 1.0 when nothing is known about the available memory.
     */
    public double getSuggestedScale() {
        if (availableBytes <= 0 || requestedBytes <= 0) {
            return availableBytes == 0 ? 0.0 : 1.0;
        }
        return Math.min(1.0, Math.sqrt((double) availableBytes / requestedBytes));
    }
}
