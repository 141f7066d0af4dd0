package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.ClaheParams;

/**
 * Contrast limited adaptive histogram equalization.
 *
 * The image is split into gridX x gridY tiles, each tile gets its own
 * equalization curve built from a {@code bins}-bin histogram, and every pixel is
 * mapped through the bilinear blend of the four nearest tile curves. Colour
 * images are equalized on luma only (YCbCr), keeping chroma. A clip limit of 0
 * disables clipping.
 */
public class ClaheFilter extends FilterBase {

    private final double clipLimit;
    private final int gridX;
    private final int gridY;
    private final int bins;

    public ClaheFilter(ClaheParams params) {
        this.clipLimit = params.getClipLimit();
        this.gridX = Math.max(1, params.getGridSizeX());
        this.gridY = Math.max(1, params.getGridSizeY());
        this.bins = Math.max(2, Math.min(256, params.getBins()));
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        int colors = source.getLayout().getColorChannels();
        byte[] in = source.rawData();
        int pixels = width * height;

        int[] luma = new int[pixels];
        double[] cb = colors == 3 ? new double[pixels] : null;
        double[] cr = colors == 3 ? new double[pixels] : null;
        for (int i = 0; i < pixels; i++) {
            int base = i * channels;
            if (colors == 1) {
                luma[i] = in[base] & 0xFF;
            } else {
                double r = in[base] & 0xFF;
                double g = in[base + 1] & 0xFF;
                double b = in[base + 2] & 0xFF;
                double y = 0.299 * r + 0.587 * g + 0.114 * b;
                luma[i] = clamp255((int) Math.floor(y + 0.5));
                cb[i] = -0.168736 * r - 0.331264 * g + 0.5 * b;
                cr[i] = 0.5 * r - 0.418688 * g - 0.081312 * b;
            }
        }

        int[] mapped = equalize(luma, width, height);

        PixelBuffer output = allocator.allocateLike(source);
        byte[] out = output.rawData();
        for (int i = 0; i < pixels; i++) {
            int base = i * channels;
            if (colors == 1) {
                out[base] = (byte) mapped[i];
            } else if (mapped[i] == luma[i]) {
                out[base] = in[base];
                out[base + 1] = in[base + 1];
                out[base + 2] = in[base + 2];
            } else {
                double y = mapped[i];
                out[base] = (byte) clamp255((int) Math.floor(y + 1.402 * cr[i] + 0.5));
                out[base + 1] = (byte) clamp255((int) Math.floor(y - 0.344136 * cb[i] - 0.714136 * cr[i] + 0.5));
                out[base + 2] = (byte) clamp255((int) Math.floor(y + 1.772 * cb[i] + 0.5));
            }
            if (source.getLayout().hasAlpha()) {
                out[base + channels - 1] = in[base + channels - 1];
            }
        }
        return output;
    }

    int[] equalize(int[] values, int width, int height) {
        int tilesX = Math.min(gridX, width);
        int tilesY = Math.min(gridY, height);
        int[] xBounds = bounds(width, tilesX);
        int[] yBounds = bounds(height, tilesY);

        // per-tile mapping from bin to output value
        double[][][] luts = new double[tilesY][tilesX][];
        for (int ty = 0; ty < tilesY; ty++) {
            for (int tx = 0; tx < tilesX; tx++) {
                luts[ty][tx] = tileLut(values, width, xBounds[tx], xBounds[tx + 1], yBounds[ty], yBounds[ty + 1]);
            }
        }

        int[] result = new int[values.length];
        for (int y = 0; y < height; y++) {
            double gy = (y + 0.5) * tilesY / height - 0.5;
            int ty0 = (int) Math.floor(gy);
            double fy = gy - ty0;
            int ty1 = Math.min(tilesY - 1, ty0 + 1);
            ty0 = Math.max(0, ty0);
            if (gy < 0) fy = 0;
            for (int x = 0; x < width; x++) {
                double gx = (x + 0.5) * tilesX / width - 0.5;
                int tx0 = (int) Math.floor(gx);
                double fx = gx - tx0;
                int tx1 = Math.min(tilesX - 1, tx0 + 1);
                tx0 = Math.max(0, tx0);
                if (gx < 0) fx = 0;

                int value = values[y * width + x];
                int bin = value * bins / 256;
                double top = mix(map(luts[ty0][tx0], value, bin), map(luts[ty0][tx1], value, bin), fx);
                double bottom = mix(map(luts[ty1][tx0], value, bin), map(luts[ty1][tx1], value, bin), fx);
                result[y * width + x] = clamp255((int) Math.floor(mix(top, bottom, fy) + 0.5));
            }
        }
        return result;
    }

    private double[] tileLut(int[] values, int width, int x0, int x1, int y0, int y1) {
        int[] histogram = new int[bins];
        int count = (x1 - x0) * (y1 - y0);
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                histogram[values[y * width + x] * bins / 256]++;
            }
        }
        for (int h : histogram) {
            if (h == count) {
                // single-valued tile
                return null;
            }
        }

        if (clipLimit > 0) {
            int limit = Math.max(1, (int) (clipLimit * count / bins));
            int excess = 0;
            for (int i = 0; i < bins; i++) {
                if (histogram[i] > limit) {
                    excess += histogram[i] - limit;
                    histogram[i] = limit;
                }
            }
            int share = excess / bins;
            int remainder = excess % bins;
            for (int i = 0; i < bins; i++) {
                histogram[i] += share + (i < remainder ? 1 : 0);
            }
        }

        int cdfMin = 0;
        for (int h : histogram) {
            if (h > 0) {
                cdfMin = h;
                break;
            }
        }
        double[] lut = new double[bins];
        long cdf = 0;
        for (int i = 0; i < bins; i++) {
            cdf += histogram[i];
            lut[i] = 255.0 * Math.max(0, cdf - cdfMin) / (count - cdfMin);
        }
        return lut;
    }

    /**
     * Tile curve lookup; a null curve leaves the value unchanged.
     */
    private static double map(double[] lut, int value, int bin) {
        return lut == null ? value : lut[bin];
    }

    private static int[] bounds(int size, int tiles) {
        int[] bounds = new int[tiles + 1];
        for (int t = 0; t <= tiles; t++) {
            bounds[t] = (int) ((long) t * size / tiles);
        }
        return bounds;
    }
}
