package com.ttennebkram.imagefilter.filters;

/**
 * White where luminance reaches the threshold, black elsewhere.
 */
public class ThresholdFilter extends PointFilter {

    private final double threshold;

    public ThresholdFilter(double threshold) {
        this.threshold = threshold;
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        double value = luminance(rgb[0], rgb[1], rgb[2]) >= threshold ? 1.0 : 0.0;
        rgb[0] = value;
        rgb[1] = value;
        rgb[2] = value;
    }
}
