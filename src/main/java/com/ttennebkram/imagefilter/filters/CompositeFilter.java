package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;

import java.util.List;

/**
 * Runs several transformations in sequence as one. Intermediate buffers are
 * released as soon as the next step has consumed them.
 */
public class CompositeFilter implements PixelTransformation {

    private final List<PixelTransformation> steps;

    public CompositeFilter(List<PixelTransformation> steps) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("CompositeFilter needs at least one step");
        }
        this.steps = List.copyOf(steps);
    }

    /**
     * Neon glow: sharpen, detect edges, tint the edges with the given colour.
     */
    public static CompositeFilter neon(double lineSize, double sharpness, double red, double green, double blue) {
        return new CompositeFilter(List.of(
                new SharpenFilter(sharpness),
                new SobelEdgeFilter(lineSize),
                new RgbFilter(red, green, blue)));
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        PixelBuffer current = source;
        for (PixelTransformation step : steps) {
            PixelBuffer next;
            try {
                next = step.apply(current, allocator);
            } finally {
                if (current != source) {
                    allocator.release(current);
                }
            }
            current = next;
        }
        return current;
    }
}
