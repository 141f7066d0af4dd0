package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;

/**
 * Global histogram equalization of each colour channel. A channel holding a
 * single value is left unchanged. Alpha passes through.
 */
public class EqualizeFilter extends FilterBase {

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        int channels = source.getChannels();
        int colors = source.getLayout().getColorChannels();
        int pixels = source.getWidth() * source.getHeight();
        byte[] in = source.rawData();
        PixelBuffer output = allocator.allocateLike(source);
        byte[] out = output.rawData();

        for (int c = 0; c < channels; c++) {
            int[] lut = new int[256];
            if (c < colors) {
                int[] histogram = new int[256];
                for (int i = 0; i < pixels; i++) {
                    histogram[in[i * channels + c] & 0xFF]++;
                }
                buildLut(histogram, pixels, lut);
            } else {
                for (int v = 0; v < 256; v++) {
                    lut[v] = v;
                }
            }
            for (int i = 0; i < pixels; i++) {
                out[i * channels + c] = (byte) lut[in[i * channels + c] & 0xFF];
            }
        }
        return output;
    }

    static void buildLut(int[] histogram, int total, int[] lut) {
        int cdfMin = 0;
        for (int count : histogram) {
            if (count > 0) {
                cdfMin = count;
                break;
            }
        }
        if (total == cdfMin) {
            for (int v = 0; v < 256; v++) {
                lut[v] = v;
            }
            return;
        }
        long cdf = 0;
        for (int v = 0; v < 256; v++) {
            cdf += histogram[v];
            long scaled = Math.max(0, cdf - cdfMin) * 255L;
            long range = total - cdfMin;
            lut[v] = (int) ((scaled * 2 + range) / (2 * range));
        }
    }
}
