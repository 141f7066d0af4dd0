package com.ttennebkram.imagefilter.filters;

public class GrayscaleFilter extends PointFilter {

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        double lum = luminance(rgb[0], rgb[1], rgb[2]);
        rgb[0] = lum;
        rgb[1] = lum;
        rgb[2] = lum;
    }
}
