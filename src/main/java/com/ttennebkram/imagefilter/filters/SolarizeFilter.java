package com.ttennebkram.imagefilter.filters;

/**
 * Inverts pixels whose luminance is above the threshold.
 */
public class SolarizeFilter extends PointFilter {

    private final double threshold;

    public SolarizeFilter(double threshold) {
        this.threshold = threshold;
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        if (luminance(rgb[0], rgb[1], rgb[2]) > threshold) {
            rgb[0] = 1.0 - rgb[0];
            rgb[1] = 1.0 - rgb[1];
            rgb[2] = 1.0 - rgb[2];
        }
    }
}
