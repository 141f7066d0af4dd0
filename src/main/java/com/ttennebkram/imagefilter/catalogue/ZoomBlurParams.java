package com.ttennebkram.imagefilter.catalogue;

public final class ZoomBlurParams extends FilterParams {

    private final double radius;
    private final double sigma;
    private final double centerX;
    private final double centerY;
    private final double strength;
    private final double angle;

    public ZoomBlurParams(double radius, double sigma, double centerX, double centerY,
                          double strength, double angle) {
        this.radius = radius;
        this.sigma = sigma;
        this.centerX = centerX;
        this.centerY = centerY;
        this.strength = strength;
        this.angle = angle;
    }

    /** Number of samples taken along the zoom direction */
    public double getRadius() {
        return radius;
    }

    public double getSigma() {
        return sigma;
    }

    public double getCenterX() {
        return centerX;
    }

    public double getCenterY() {
        return centerY;
    }

    public double getStrength() {
        return strength;
    }

    /** Rotational component in degrees */
    public double getAngle() {
        return angle;
    }

    @Override
    public ParamShape getShape() {
        return ParamShape.RECORD;
    }

    @Override
    public double[] values() {
        return new double[]{radius, sigma, centerX, centerY, strength, angle};
    }

    @Override
    public ZoomBlurParams withValues(double[] values) {
        checkArity(values, 6, ZoomBlurParams.class);
        return new ZoomBlurParams(values[0], values[1], values[2], values[3], values[4], values[5]);
    }
}
