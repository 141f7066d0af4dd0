package com.ttennebkram.imagefilter.backend;

import com.ttennebkram.imagefilter.FilterExecutionException;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import com.ttennebkram.imagefilter.catalogue.FilterParams;

/**
 * Executes single filters on pixel buffers.
 *
 * Implementations must be deterministic: the same kind, payload and source
 * content always produce the same output bytes. The source is never modified;
 * the result is a new buffer.
 */
public interface FilterBackend {

    /**
     * @param kind   the filter to run
     * @param params an already validated payload of the kind's shape
     * @param source the input buffer
     * @return a new buffer with the same dimensions and layout
     * @throws UnsupportedFilterKindException if this backend cannot serve the kind
     * @throws FilterExecutionException       on allocation or backend failure
     */
    PixelBuffer transform(FilterKind kind, FilterParams params, PixelBuffer source) throws FilterExecutionException;

    boolean supports(FilterKind kind);

    /**
     * Short name for logs, e.g. "java" or "opencv".
     */
    String getName();
}
