package com.ttennebkram.imagefilter.filters;

/**
 * Raises normalized components to a power; values above one darken.
 */
public class GammaFilter extends PointFilter {

    private final double gamma;

    public GammaFilter(double gamma) {
        this.gamma = gamma;
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        for (int c = 0; c < 3; c++) {
            rgb[c] = Math.pow(rgb[c], gamma);
        }
    }
}
