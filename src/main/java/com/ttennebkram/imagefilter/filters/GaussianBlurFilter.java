package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.EdgeMode;

/**
 * Separable Gaussian blur with a (2 * radius + 1) kernel and sigma = radius / 3.
 */
public class GaussianBlurFilter extends FilterBase {

    private final int radius;
    private final EdgeMode edgeMode;

    public GaussianBlurFilter(int radius, EdgeMode edgeMode) {
        this.radius = Math.max(1, radius);
        this.edgeMode = edgeMode;
    }

    static double[] kernel(int radius) {
        double sigma = Math.max(radius / 3.0, 0.5);
        double[] kernel = new double[2 * radius + 1];
        for (int i = -radius; i <= radius; i++) {
            kernel[i + radius] = Math.exp(-(i * i) / (2 * sigma * sigma));
        }
        return Convolutions.normalize(kernel);
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        return Convolutions.separable(source, kernel(radius), edgeMode, allocator);
    }
}
