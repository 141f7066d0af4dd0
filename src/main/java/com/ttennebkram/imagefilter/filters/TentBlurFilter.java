package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.EdgeMode;

/**
 * Triangle-weighted blur. Even sizes are rounded up to the next odd size.
 */
public class TentBlurFilter extends FilterBase {

    private final int size;

    public TentBlurFilter(int size) {
        this.size = oddSize(size);
    }

    static int oddSize(int size) {
        int s = Math.max(1, size);
        return s % 2 == 0 ? s + 1 : s;
    }

    public int getSize() {
        return size;
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        int half = size / 2;
        double[] kernel = new double[size];
        for (int i = 0; i < size; i++) {
            kernel[i] = half + 1 - Math.abs(i - half);
        }
        return Convolutions.separable(source, Convolutions.normalize(kernel), EdgeMode.REFLECT_101, allocator);
    }
}
