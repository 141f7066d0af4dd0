package com.ttennebkram.imagefilter.filters;

/**
 * Multiplies components by 2^exposure, i.e. exposure is measured in stops.
 */
public class ExposureFilter extends PointFilter {

    private final double factor;

    public ExposureFilter(double exposure) {
        this.factor = Math.pow(2.0, exposure);
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        rgb[0] *= factor;
        rgb[1] *= factor;
        rgb[2] *= factor;
    }
}
