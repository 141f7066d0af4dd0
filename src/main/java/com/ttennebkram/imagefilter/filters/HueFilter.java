package com.ttennebkram.imagefilter.filters;

/**
 * Rotates hue in YIQ space, keeping luma (Y) and chroma magnitude.
 */
public class HueFilter extends PointFilter {

    private final double cos;
    private final double sin;

    /**
     * @param angle rotation in degrees
     */
    public HueFilter(double angle) {
        double radians = Math.toRadians(angle % 360.0);
        this.cos = Math.cos(-radians);
        this.sin = Math.sin(-radians);
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        double r = rgb[0];
        double g = rgb[1];
        double b = rgb[2];
        double y = 0.299 * r + 0.587 * g + 0.114 * b;
        double i = 0.595716 * r - 0.274453 * g - 0.321263 * b;
        double q = 0.211456 * r - 0.522591 * g + 0.311135 * b;

        double ri = i * cos - q * sin;
        double rq = i * sin + q * cos;

        rgb[0] = y + 0.9563 * ri + 0.6210 * rq;
        rgb[1] = y - 0.2721 * ri - 0.6474 * rq;
        rgb[2] = y - 1.1070 * ri + 1.7046 * rq;
    }
}
