package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;

import java.util.Arrays;

/**
 * Replaces each block of pixels, aligned to the top-left corner, with its average.
 */
public class PixelateFilter extends FilterBase {

    private final int blockSize;

    public PixelateFilter(int blockSize) {
        this.blockSize = Math.max(1, blockSize);
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        byte[] in = source.rawData();
        PixelBuffer output = allocator.allocateLike(source);
        byte[] out = output.rawData();
        long[] sums = new long[channels];

        for (int by = 0; by < height; by += blockSize) {
            int yEnd = Math.min(height, by + blockSize);
            for (int bx = 0; bx < width; bx += blockSize) {
                int xEnd = Math.min(width, bx + blockSize);
                Arrays.fill(sums, 0);
                for (int y = by; y < yEnd; y++) {
                    for (int x = bx; x < xEnd; x++) {
                        int base = (y * width + x) * channels;
                        for (int c = 0; c < channels; c++) {
                            sums[c] += in[base + c] & 0xFF;
                        }
                    }
                }
                long n = (long) (yEnd - by) * (xEnd - bx);
                for (int y = by; y < yEnd; y++) {
                    for (int x = bx; x < xEnd; x++) {
                        int base = (y * width + x) * channels;
                        for (int c = 0; c < channels; c++) {
                            out[base + c] = (byte) ((sums[c] * 2 + n) / (2 * n));
                        }
                    }
                }
            }
        }
        return output;
    }
}
