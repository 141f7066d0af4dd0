package com.ttennebkram.imagefilter;

import com.ttennebkram.imagefilter.catalogue.FilterKind;

/**
 * Base class for recoverable filter failures.
 * Resource and backend failures extend this; the caller decides whether to
 * retry, downscale or abort.
 */
public class FilterExecutionException extends Exception {

    private final FilterKind kind;

    public FilterExecutionException(String message) {
        this(message, null, null);
    }

    public FilterExecutionException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public FilterExecutionException(String message, FilterKind kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * The filter kind that failed, or null when the failure is not tied to one.
     */
    public FilterKind getKind() {
        return kind;
    }
}
