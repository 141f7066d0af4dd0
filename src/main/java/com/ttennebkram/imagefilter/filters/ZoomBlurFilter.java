package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.catalogue.ZoomBlurParams;

import java.util.Arrays;

/**
 * Radial blur towards a centre point. Samples along the line to the centre are
 * Gaussian weighted by their index; each sample is also turned about the centre
 * by a fraction of {@code angle}, giving a slight spin.
 */
public class ZoomBlurFilter extends FilterBase {

    /** Fraction of the way to the centre reached at strength 1 */
    private static final double REACH = 0.25;
    /** Fraction of the angle applied at full reach */
    private static final double SPIN = 0.05;

    private final int samples;
    private final double sigma;
    private final double centerX;
    private final double centerY;
    private final double strength;
    private final double angle;

    public ZoomBlurFilter(ZoomBlurParams params) {
        this.samples = Math.max(1, (int) Math.round(params.getRadius()));
        this.sigma = Math.max(params.getSigma(), 0.5);
        this.centerX = params.getCenterX();
        this.centerY = params.getCenterY();
        this.strength = params.getStrength();
        this.angle = Math.toRadians(params.getAngle());
    }

    @Override
    public PixelBuffer apply(PixelBuffer source, BufferAllocator allocator) throws AllocationFailureException {
        int width = source.getWidth();
        int height = source.getHeight();
        int channels = source.getChannels();
        double cx = centerX * (width - 1);
        double cy = centerY * (height - 1);

        double[] weights = new double[samples];
        double[] cos = new double[samples];
        double[] sin = new double[samples];
        double[] scale = new double[samples];
        double total = 0;
        for (int i = 0; i < samples; i++) {
            double t = (double) i / samples * strength * REACH;
            weights[i] = Math.exp(-(i * (double) i) / (2 * sigma * sigma));
            total += weights[i];
            scale[i] = 1 - t;
            cos[i] = Math.cos(angle * t * SPIN / REACH);
            sin[i] = Math.sin(angle * t * SPIN / REACH);
        }

        PixelBuffer output = allocator.allocateLike(source);
        byte[] out = output.rawData();
        double[] sums = new double[channels];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                Arrays.fill(sums, 0);
                double dx = x - cx;
                double dy = y - cy;
                for (int i = 0; i < samples; i++) {
                    double sx = dx * scale[i];
                    double sy = dy * scale[i];
                    double px = cx + cos[i] * sx - sin[i] * sy;
                    double py = cy + sin[i] * sx + cos[i] * sy;
                    for (int c = 0; c < channels; c++) {
                        sums[c] += weights[i] * sampleBilinear(source, px, py, c);
                    }
                }
                int base = (y * width + x) * channels;
                for (int c = 0; c < channels; c++) {
                    out[base + c] = (byte) clamp255((int) Math.floor(sums[c] / total + 0.5));
                }
            }
        }
        return output;
    }
}
