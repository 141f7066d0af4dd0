package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;

import java.util.Arrays;

/**
 * Median of a (2 * radius + 1) square window per channel, edges clamped.
 * Uses a running histogram that slides along each row.
 */
public class MedianBlurFilter extends FilterBase {

    private final int radius;

    public MedianBlurFilter(int radius) {
        this.radius = Math.max(1, radius);
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        int window = (2 * radius + 1) * (2 * radius + 1);
        int rank = window / 2;
        PixelBuffer output = allocator.allocateLike(source);
        byte[] out = output.rawData();
        int[] histogram = new int[256];

        for (int c = 0; c < channels; c++) {
            for (int y = 0; y < height; y++) {
                Arrays.fill(histogram, 0);
                for (int dy = -radius; dy <= radius; dy++) {
                    for (int dx = -radius; dx <= radius; dx++) {
                        histogram[sampleClamped(source, dx, y + dy, c)]++;
                    }
                }
                for (int x = 0; x < width; x++) {
                    if (x > 0) {
                        for (int dy = -radius; dy <= radius; dy++) {
                            histogram[sampleClamped(source, x - radius - 1, y + dy, c)]--;
                            histogram[sampleClamped(source, x + radius, y + dy, c)]++;
                        }
                    }
                    int count = 0;
                    int value = 0;
                    while (value < 255 && count + histogram[value] <= rank) {
                        count += histogram[value];
                        value++;
                    }
                    out[(y * width + x) * channels + c] = (byte) value;
                }
            }
        }
        return output;
    }
}
