package com.ttennebkram.imagefilter.filters;

/**
 * Per-channel gain.
 */
public class RgbFilter extends PointFilter {

    private final double red;
    private final double green;
    private final double blue;

    public RgbFilter(double red, double green, double blue) {
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        rgb[0] *= red;
        rgb[1] *= green;
        rgb[2] *= blue;
    }
}
