package com.ttennebkram.imagefilter.catalogue;

/**
 * Pinch / whirl distortion. Centre and radius are relative to the image:
 * centre in [0,1] of width/height, radius in units of half the shorter side.
 */
public final class PinchParams extends FilterParams {

    private final double angle;
    private final double centerX;
    private final double centerY;
    private final double radius;
    private final double amount;

    public PinchParams(double angle, double centerX, double centerY, double radius, double amount) {
        this.angle = angle;
        this.centerX = centerX;
        this.centerY = centerY;
        this.radius = radius;
        this.amount = amount;
    }

    /** Whirl angle in degrees */
    public double getAngle() {
        return angle;
    }

    public double getCenterX() {
        return centerX;
    }

    public double getCenterY() {
        return centerY;
    }

    public double getRadius() {
        return radius;
    }

    public double getAmount() {
        return amount;
    }

    @Override
    public ParamShape getShape() {
        return ParamShape.RECORD;
    }

    @Override
    public double[] values() {
        return new double[]{angle, centerX, centerY, radius, amount};
    }

    @Override
    public PinchParams withValues(double[] values) {
        checkArity(values, 5, PinchParams.class);
        return new PinchParams(values[0], values[1], values[2], values[3], values[4]);
    }
}
