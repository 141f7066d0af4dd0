package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.EdgeMode;

import java.util.Arrays;

public class BoxBlurFilter extends FilterBase {

    private final int radius;

    public BoxBlurFilter(int radius) {
        this.radius = Math.max(1, radius);
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        double[] kernel = new double[2 * radius + 1];
        Arrays.fill(kernel, 1.0);
        return Convolutions.separable(source, Convolutions.normalize(kernel), EdgeMode.REFLECT_101, allocator);
    }
}
