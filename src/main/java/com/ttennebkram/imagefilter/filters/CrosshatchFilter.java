package com.ttennebkram.imagefilter.filters;

/**
 * Pen crosshatch: up to four line directions are drawn, more of them the darker
 * the pixel. Spacing and line width are fractions of the image size.
 */
public class CrosshatchFilter extends PointFilter {

    private final double spacing;
    private final double lineWidth;

    public CrosshatchFilter(double spacing, double lineWidth) {
        this.spacing = spacing;
        this.lineWidth = lineWidth;
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        double lum = luminance(rgb[0], rgb[1], rgb[2]);
        double half = spacing / 2.0;
        double value = 1.0;
        if (lum < 1.00 && mod(u + v, spacing) <= lineWidth) {
            value = 0.0;
        }
        if (lum < 0.75 && mod(u - v, spacing) <= lineWidth) {
            value = 0.0;
        }
        if (lum < 0.50 && mod(u + v - half, spacing) <= lineWidth) {
            value = 0.0;
        }
        if (lum < 0.30 && mod(u - v - half, spacing) <= lineWidth) {
            value = 0.0;
        }
        rgb[0] = value;
        rgb[1] = value;
        rgb[2] = value;
    }

    private static double mod(double x, double m) {
        return x - m * Math.floor(x / m);
    }
}
