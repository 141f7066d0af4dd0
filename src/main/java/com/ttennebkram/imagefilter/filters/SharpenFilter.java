package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;

/**
 * Unsharp 4-neighbour kernel: centre weighted 1 + 4s, direct neighbours -s.
 * Negative sharpness softens. Alpha passes through.
 */
public class SharpenFilter extends FilterBase {

    private final double sharpness;

    public SharpenFilter(double sharpness) {
        this.sharpness = sharpness;
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        int colors = source.getLayout().getColorChannels();
        double center = 1 + 4 * sharpness;

        PixelBuffer output = allocator.allocateLike(source);
        byte[] out = output.rawData();
        byte[] in = source.rawData();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int base = (y * width + x) * channels;
                for (int c = 0; c < colors; c++) {
                    double neighbours = sampleClamped(source, x - 1, y, c) + sampleClamped(source, x + 1, y, c)
                            + sampleClamped(source, x, y - 1, c) + sampleClamped(source, x, y + 1, c);
                    double value = (in[base + c] & 0xFF) * center - neighbours * sharpness;
                    out[base + c] = (byte) clamp255((int) Math.floor(value + 0.5));
                }
                if (source.getLayout().hasAlpha()) {
                    out[base + channels - 1] = in[base + channels - 1];
                }
            }
        }
        return output;
    }
}
