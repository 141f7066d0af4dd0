package com.ttennebkram.imagefilter.filters;

/**
 * Adds or removes white haze. The haze amount grows linearly from top to bottom
 * by {@code slope}; a negative distance removes haze.
 */
public class HazeFilter extends PointFilter {

    private final double distance;
    private final double slope;

    public HazeFilter(double distance, double slope) {
        this.distance = distance;
        this.slope = slope;
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        double d = v * slope + distance;
        if (d >= 1.0) {
            rgb[0] = 1.0;
            rgb[1] = 1.0;
            rgb[2] = 1.0;
            return;
        }
        for (int c = 0; c < 3; c++) {
            rgb[c] = (rgb[c] - d) / (1.0 - d);
        }
    }
}
