package com.ttennebkram.imagefilter.filters;

/**
 * Adds a constant to every colour component.
 */
public class BrightnessFilter extends PointFilter {

    private final double brightness;

    public BrightnessFilter(double brightness) {
        this.brightness = brightness;
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        rgb[0] += brightness;
        rgb[1] += brightness;
        rgb[2] += brightness;
    }
}
