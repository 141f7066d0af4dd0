package com.ttennebkram.imagefilter.filters;

public class InvertFilter extends PointFilter {

    @Override
    protected void filterPixel(double[] rgb, double u, double v) {
        rgb[0] = 1.0 - rgb[0];
        rgb[1] = 1.0 - rgb[1];
        rgb[2] = 1.0 - rgb[2];
    }
}
