package com.ttennebkram.imagefilter.filters;

/**
 * Darkens towards the corners. Pixels closer to the centre than {@code start}
 * are unchanged, pixels beyond {@code end} are black, with a smoothstep between.
 */
public class VignetteFilter extends PointFilter {

    private final double start;
    private final double end;

    public VignetteFilter(double start, double end) {
        this.start = start;
        this.end = end;
    }

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        double du = u - 0.5;
        double dv = v - 0.5;
        double percent = smoothstep(start, end, Math.sqrt(du * du + dv * dv));
        double keep = 1.0 - percent;
        rgb[0] *= keep;
        rgb[1] *= keep;
        rgb[2] *= keep;
    }
}
