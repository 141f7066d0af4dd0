package com.ttennebkram.imagefilter.cache;

import com.ttennebkram.imagefilter.FilterExecutionException;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;

/**
 * Produces the buffer for a cache miss.
 */
@FunctionalInterface
public interface FilterComputation {

    PixelBuffer compute() throws FilterExecutionException;
}
