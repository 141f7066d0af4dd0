package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.ChannelLayout;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;

/**
 * Base for filters that map each pixel's colour independently.
 *
 * Subclasses see normalised RGB in [0,1] and the pixel's normalised position.
 * Gray input is expanded to equal RGB components; the result is written back as
 * the common value when the components stay equal, as luminance otherwise.
 * Alpha passes through unchanged.
 */
public abstract class PointFilter extends FilterBase {

    /**
     * Transform one pixel in place.
     *
     * @param rgb three normalised components, updated in place
     * @param u   horizontal position, 0 at the left edge and 1 at the right
     * @param v   vertical position, 0 at the top edge and 1 at the bottom
     */
    protected abstract void filterPixel(double[] rgb, double u, double v);

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        PixelBuffer output = allocator.allocateLike(source);
        int width = source.getWidth();
        int height = source.getHeight();
        ChannelLayout layout = source.getLayout();
        int channels = layout.getChannels();
        byte[] in = source.rawData();
        byte[] out = output.rawData();
        double[] rgb = new double[3];

        for (int y = 0; y < height; y++) {
            double v = height > 1 ? (double) y / (height - 1) : 0.5;
            for (int x = 0; x < width; x++) {
                double u = width > 1 ? (double) x / (width - 1) : 0.5;
                int i = (y * width + x) * channels;
                if (layout == ChannelLayout.GRAY) {
                    double g = (in[i] & 0xFF) / 255.0;
                    rgb[0] = g;
                    rgb[1] = g;
                    rgb[2] = g;
                } else {
                    rgb[0] = (in[i] & 0xFF) / 255.0;
                    rgb[1] = (in[i + 1] & 0xFF) / 255.0;
                    rgb[2] = (in[i + 2] & 0xFF) / 255.0;
                }

                filterPixel(rgb, u, v);

                if (layout == ChannelLayout.GRAY) {
                    double g = (rgb[0] == rgb[1] && rgb[1] == rgb[2]) ? rgb[0] : luminance(rgb[0], rgb[1], rgb[2]);
                    out[i] = (byte) toByte(g);
                } else {
                    out[i] = (byte) toByte(rgb[0]);
                    out[i + 1] = (byte) toByte(rgb[1]);
                    out[i + 2] = (byte) toByte(rgb[2]);
                    if (layout.hasAlpha()) {
                        out[i + 3] = in[i + 3];
                    }
                }
            }
        }
        return output;
    }
}
