package com.ttennebkram.imagefilter.filters;

/**
 * Sepia tone colour matrix, blended with the original by intensity.
 */
public class SepiaFilter extends PointFilter {

    private final double intensity;

    public SepiaFilter(double intensity) {
        this.intensity = intensity;
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        double r = rgb[0];
        double g = rgb[1];
        double b = rgb[2];
        double sr = 0.3588 * r + 0.7044 * g + 0.1368 * b;
        double sg = 0.2990 * r + 0.5870 * g + 0.1140 * b;
        double sb = 0.2392 * r + 0.4696 * g + 0.0912 * b;
        rgb[0] = mix(r, sr, intensity);
        rgb[1] = mix(g, sg, intensity);
        rgb[2] = mix(b, sb, intensity);
    }
}
