package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;

import java.util.ArrayList;
import java.util.List;

/**
 * Grayscale morphology on each colour channel with a square or elliptical
 * structuring element. Pixels outside the image are ignored. Alpha passes through.
 */
public class MorphologyFilter extends FilterBase {

    public enum Operation {
        DILATE, ERODE, OPEN, CLOSE
    }

    private final Operation operation;
    private final int size;
    private final boolean circle;

    public MorphologyFilter(Operation operation, int size, boolean circle) {
        this.operation = operation;
        this.size = Math.max(1, size);
        this.circle = circle;
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        List<int[]> kernel = structuringElement();
        switch (operation) {
            case DILATE:
                return pass(source, kernel, true, allocator);
            case ERODE:
                return pass(source, kernel, false, allocator);
            case OPEN:
                return twoPass(source, kernel, false, true, allocator);
            case CLOSE:
            default:
                return twoPass(source, kernel, true, false, allocator);
        }
    }

    private PixelBuffer twoPass(PixelBuffer source, List<int[]> kernel, boolean firstMax, boolean secondMax,
                                BufferAllocator allocator) throws AllocationFailureException {
        PixelBuffer first = pass(source, kernel, firstMax, allocator);
        try {
            return pass(first, kernel, secondMax, allocator);
        } finally {
            allocator.release(first);
        }
    }

    /**
     * Offsets of the structuring element, anchored at its centre. The ellipse
     * matches OpenCV's MORPH_ELLIPSE for the same size.
     */
    List<int[]> structuringElement() {
        List<int[]> offsets = new ArrayList<>();
        int anchor = size / 2;
        if (!circle) {
            for (int dy = 0; dy < size; dy++) {
                for (int dx = 0; dx < size; dx++) {
                    offsets.add(new int[]{dx - anchor, dy - anchor});
                }
            }
            return offsets;
        }
        int r = size / 2;
        double inv = r > 0 ? 1.0 / ((double) r * r) : 0;
        for (int i = 0; i < size; i++) {
            int dy = i - r;
            int half;
            if (dy == 0 || r == 0) {
                half = r;
            } else {
                half = (int) Math.round(Math.sqrt(Math.max(0, r * r * (1 - dy * dy * inv))));
            }
            for (int dx = -half; dx <= half; dx++) {
                if (dx + anchor >= 0 && dx + anchor < size) {
                    offsets.add(new int[]{dx, dy});
                }
            }
        }
        return offsets;
    }

    private static PixelBuffer pass(PixelBuffer source, List<int[]> kernel, boolean max,
                                    BufferAllocator allocator) throws AllocationFailureException {
        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        int colors = source.getLayout().getColorChannels();
        byte[] in = source.rawData();
        PixelBuffer output = allocator.allocateLike(source);
        byte[] out = output.rawData();

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int base = (y * width + x) * channels;
                for (int c = 0; c < colors; c++) {
                    int best = max ? 0 : 255;
                    for (int[] offset : kernel) {
                        int sx = x + offset[0];
                        int sy = y + offset[1];
                        if (sx < 0 || sy < 0 || sx >= width || sy >= height) {
                            continue;
                        }
                        int value = in[(sy * width + sx) * channels + c] & 0xFF;
                        best = max ? Math.max(best, value) : Math.min(best, value);
                    }
                    out[base + c] = (byte) best;
                }
                if (source.getLayout().hasAlpha()) {
                    out[base + channels - 1] = in[base + channels - 1];
                }
            }
        }
        return output;
    }
}
