package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;

/**
 * Sobel gradient magnitude of luminance, sampled {@code lineSize} pixels apart.
 * Edges come out white on black. Alpha passes through.
 */
public class SobelEdgeFilter extends FilterBase {

    private final double lineSize;

    public SobelEdgeFilter(double lineSize) {
        this.lineSize = lineSize;
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        int colors = source.getLayout().getColorChannels();

        double[] lum = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                lum[y * width + x] = colors == 1
                        ? source.get(x, y, 0) / 255.0
                        : luminance(source.get(x, y, 0) / 255.0, source.get(x, y, 1) / 255.0,
                                source.get(x, y, 2) / 255.0);
            }
        }

        PixelBuffer output = allocator.allocateLike(source);
        byte[] out = output.rawData();
        byte[] in = source.rawData();
        double s = lineSize;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double tl = lum(lum, width, height, x - s, y - s);
                double t = lum(lum, width, height, x, y - s);
                double tr = lum(lum, width, height, x + s, y - s);
                double l = lum(lum, width, height, x - s, y);
                double r = lum(lum, width, height, x + s, y);
                double bl = lum(lum, width, height, x - s, y + s);
                double b = lum(lum, width, height, x, y + s);
                double br = lum(lum, width, height, x + s, y + s);

                double h = -tl - 2 * t - tr + bl + 2 * b + br;
                double v = -bl - 2 * l - tl + br + 2 * r + tr;
                int magnitude = toByte(Math.sqrt(h * h + v * v));

                int base = (y * width + x) * channels;
                for (int c = 0; c < colors; c++) {
                    out[base + c] = (byte) magnitude;
                }
                if (source.getLayout().hasAlpha()) {
                    out[base + channels - 1] = in[base + channels - 1];
                }
            }
        }
        return output;
    }

    private static double lum(double[] lum, int width, int height, double x, double y) {
        int x0 = (int) Math.floor(x);
        int y0 = (int) Math.floor(y);
        double fx = x - x0;
        double fy = y - y0;
        double top = mix(at(lum, width, height, x0, y0), at(lum, width, height, x0 + 1, y0), fx);
        double bottom = mix(at(lum, width, height, x0, y0 + 1), at(lum, width, height, x0 + 1, y0 + 1), fx);
        return mix(top, bottom, fy);
    }

    private static double at(double[] lum, int width, int height, int x, int y) {
        int cx = x < 0 ? 0 : (x >= width ? width - 1 : x);
        int cy = y < 0 ? 0 : (y >= height ? height - 1 : y);
        return lum[cy * width + cx];
    }
}
