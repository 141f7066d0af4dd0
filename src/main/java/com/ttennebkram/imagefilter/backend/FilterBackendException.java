package com.ttennebkram.imagefilter.backend;

import com.ttennebkram.imagefilter.FilterExecutionException;
import com.ttennebkram.imagefilter.catalogue.FilterKind;

/**
 * A backend failed while running a filter. Recoverable; the source buffer is intact.
 */
public class FilterBackendException extends FilterExecutionException {

    public FilterBackendException(String message, FilterKind kind, Throwable cause) {
        super(message, kind, cause);
    }
}
