package com.ttennebkram.imagefilter.filters;

import com.ttennebkram.imagefilter.buffer.PixelBuffer;

/**
 * Abstract base class for pixel transformations.
 * Provides common helper methods for channel arithmetic and sampling.
 */
public abstract class FilterBase implements PixelTransformation {

    /** Rec. 709 luma weights */
    protected static final double LUMA_R = 0.2125;
    protected static final double LUMA_G = 0.7154;
    protected static final double LUMA_B = 0.0721;

    protected static double clamp01(double v) {
        return v < 0 ? 0 : (v > 1 ? 1 : v);
    }

    protected static int clamp255(int v) {
        return v < 0 ? 0 : (v > 255 ? 255 : v);
    }

    protected static double clamp(double v, double lo, double hi) {
        return v < lo ? lo : (v > hi ? hi : v);
    }

    /**
     * Normalised [0,1] value to an 8-bit channel, rounded half up.
     */
    protected static int toByte(double v) {
        return (int) Math.floor(clamp01(v) * 255.0 + 0.5);
    }

    protected static double luminance(double r, double g, double b) {
        return r * LUMA_R + g * LUMA_G + b * LUMA_B;
    }

    protected static double smoothstep(double edge0, double edge1, double x) {
        if (edge0 == edge1) {
            return x < edge0 ? 0 : 1;
        }
        double t = clamp01((x - edge0) / (edge1 - edge0));
        return t * t * (3 - 2 * t);
    }

    protected static double mix(double a, double b, double t) {
        return a * (1 - t) + b * t;
    }

    /**
     * Channel value at (x, y), with coordinates clamped to the buffer edges.
     */
    protected static int sampleClamped(PixelBuffer source, int x, int y, int channel) {
        int cx = x < 0 ? 0 : (x >= source.getWidth() ? source.getWidth() - 1 : x);
        int cy = y < 0 ? 0 : (y >= source.getHeight() ? source.getHeight() - 1 : y);
        return source.get(cx, cy, channel);
    }

    /**
     * Bilinear interpolation of a channel at a fractional position, clamped to the edges.
     */
    protected static double sampleBilinear(PixelBuffer source, double x, double y, int channel) {
        int x0 = (int) Math.floor(x);
        int y0 = (int) Math.floor(y);
        double fx = x - x0;
        double fy = y - y0;
        double top = mix(sampleClamped(source, x0, y0, channel), sampleClamped(source, x0 + 1, y0, channel), fx);
        double bottom = mix(sampleClamped(source, x0, y0 + 1, channel),
                sampleClamped(source, x0 + 1, y0 + 1, channel), fx);
        return mix(top, bottom, fy);
    }
}
