package com.ttennebkram.imagefilter.mask;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.ChannelLayout;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;

/**
 * Blends a filtered image into the original through a mask.
 *
 * Per channel, alpha included: out = original * (1 - c) + filtered * c, with c the
 * pixel's coverage, rounded half up. Zero coverage reproduces the original
 * exactly and full coverage the filtered image.
 */
public class MaskCompositor {

    /** Opacity of the tint drawn by {@link #preview} */
    private static final int PREVIEW_OPACITY_PERCENT = 50;

    private final MaskRasterizer rasterizer;
    private final BufferAllocator allocator;

    public MaskCompositor(MaskRasterizer rasterizer, BufferAllocator allocator) {
        this.rasterizer = rasterizer;
        this.allocator = allocator;
    }

    public MaskRasterizer getRasterizer() {
        return rasterizer;
    }

    /**
     * @throws DimensionMismatchException if the buffers or the mask canvas differ in size or layout
     */
    public PixelBuffer composite(PixelBuffer original, PixelBuffer filtered, Mask mask)
            throws AllocationFailureException {
        checkDimensions(original, filtered, mask);
        return composite(original, filtered, rasterizer.coverage(mask));
    }

    public PixelBuffer composite(PixelBuffer original, PixelBuffer filtered, CoverageMap coverage)
            throws AllocationFailureException {
        checkDimensions(original, filtered, coverage.getWidth(), coverage.getHeight());
        int full = coverage.getFullCoverage();
        int half = full / 2;
        int channels = original.getChannels();
        int pixels = original.getWidth() * original.getHeight();
        byte[] o = original.rawData();
        byte[] f = filtered.rawData();

        PixelBuffer output = allocator.allocateLike(original);
        byte[] out = output.rawData();
        for (int p = 0; p < pixels; p++) {
            int k = coverage.getAt(p);
            int base = p * channels;
            if (k == 0) {
                System.arraycopy(o, base, out, base, channels);
            } else if (k == full) {
                System.arraycopy(f, base, out, base, channels);
            } else {
                for (int c = 0; c < channels; c++) {
                    int blended = ((o[base + c] & 0xFF) * (full - k) + (f[base + c] & 0xFF) * k + half) / full;
                    out[base + c] = (byte) blended;
                }
            }
        }
        return output;
    }

    /**
     * Original image with the mask's covered area tinted in its preview colour.
     */
    public PixelBuffer preview(PixelBuffer original, Mask mask) throws AllocationFailureException {
        if (original.getWidth() != mask.getWidth() || original.getHeight() != mask.getHeight()) {
            throw new DimensionMismatchException("Mask canvas " + mask.getWidth() + "x" + mask.getHeight()
                    + " does not match " + original);
        }
        CoverageMap coverage = rasterizer.coverage(mask);
        int full = coverage.getFullCoverage() * 100;
        int color = mask.getPreviewColor();
        int[] tint = {(color >> 16) & 0xFF, (color >> 8) & 0xFF, color & 0xFF};
        ChannelLayout layout = original.getLayout();
        if (layout == ChannelLayout.GRAY) {
            tint[0] = (int) Math.round(0.2125 * tint[0] + 0.7154 * tint[1] + 0.0721 * tint[2]);
        }

        int colors = layout.getColorChannels();
        int channels = layout.getChannels();
        int pixels = original.getWidth() * original.getHeight();
        byte[] in = original.rawData();
        PixelBuffer output = allocator.allocateLike(original);
        byte[] out = output.rawData();
        for (int p = 0; p < pixels; p++) {
            int weight = coverage.getAt(p) * PREVIEW_OPACITY_PERCENT;
            int base = p * channels;
            for (int c = 0; c < channels; c++) {
                int v = in[base + c] & 0xFF;
                if (c < colors && weight > 0) {
                    v = (v * (full - weight) + tint[c] * weight + full / 2) / full;
                }
                out[base + c] = (byte) v;
            }
        }
        return output;
    }

    private static void checkDimensions(PixelBuffer original, PixelBuffer filtered, Mask mask) {
        checkDimensions(original, filtered, mask.getWidth(), mask.getHeight());
    }

    private static void checkDimensions(PixelBuffer original, PixelBuffer filtered, int width, int height) {
        if (!original.sameDimensions(filtered)) {
            throw new DimensionMismatchException("Filtered " + filtered + " does not match original " + original);
        }
        if (original.getWidth() != width || original.getHeight() != height) {
            throw new DimensionMismatchException("Mask canvas " + width + "x" + height
                    + " does not match " + original);
        }
    }
}
