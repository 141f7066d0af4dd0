package com.ttennebkram.imagefilter.filters;

/**
 * Interpolates between the pixel's luminance (0) and its colour (1), extrapolating above 1.
 */
public class SaturationFilter extends PointFilter {

    private final double saturation;

    public SaturationFilter(double saturation) {
        this.saturation = saturation;
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        double lum = luminance(rgb[0], rgb[1], rgb[2]);
        for (int c = 0; c < 3; c++) {
            rgb[c] = mix(lum, rgb[c], saturation);
        }
    }
}
