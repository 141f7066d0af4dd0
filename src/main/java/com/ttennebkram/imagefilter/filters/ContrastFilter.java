package com.ttennebkram.imagefilter.filters;

/**
 * Scales components around mid gray.
 */
public class ContrastFilter extends PointFilter {

    private final double contrast;

    public ContrastFilter(double contrast) {
        this.contrast = contrast;
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        for (int c = 0; c < 3; c++) {
            rgb[c] = (rgb[c] - 0.5) * contrast + 0.5;
        }
    }
}
