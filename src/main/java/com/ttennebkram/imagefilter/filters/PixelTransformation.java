package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;

/**
 * One configured pixel transformation.
 */
@FunctionalInterface
public interface PixelTransformation {

    /**
     * Transform the source into a newly allocated buffer of the same size and layout.
     *
     * @param source    the input buffer (do not modify)
     * @param allocator where the output buffer comes from
     * @return the output buffer, owned by the caller
     */
    PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException;
}
