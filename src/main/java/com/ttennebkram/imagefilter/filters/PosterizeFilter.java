package com.ttennebkram.imagefilter.filters;

/**
 * Quantises each component to the given number of levels.
 */
public class PosterizeFilter extends PointFilter {

    private final double levels;

    public PosterizeFilter(int levels) {
        this.levels = Math.max(1, levels);
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        for (int c = 0; c < 3; c++) {
            rgb[c] = Math.floor(rgb[c] * levels + 0.5) / levels;
        }
    }
}
