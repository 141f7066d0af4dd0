package com.ttennebkram.imagefilter.catalogue;

/**
 * Neon glow: edges detected after sharpening, tinted with a packed 0xRRGGBB colour.
 */
public final class NeonParams extends FilterParams {

    private final double lineSize;
    private final double sharpness;
    private final int color;

    public NeonParams(double lineSize, double sharpness, int color) {
        this.lineSize = lineSize;
        this.sharpness = sharpness;
        this.color = color & 0xFFFFFF;
    }

    public double getLineSize() {
        return lineSize;
    }

    public double getSharpness() {
        return sharpness;
    }

    public int getColor() {
        return color;
    }

    public double getRed() {
        return ((color >> 16) & 0xFF) / 255.0;
    }

    public double getGreen() {
        return ((color >> 8) & 0xFF) / 255.0;
    }

    public double getBlue() {
        return (color & 0xFF) / 255.0;
    }

    @Override
    public ParamShape getShape() {
        return ParamShape.RECORD;
    }

    @Override
    public double[] values() {
        return new double[]{lineSize, sharpness, color};
    }

    @Override
    public NeonParams withValues(double[] values) {
        checkArity(values, 3, NeonParams.class);
        return new NeonParams(values[0], values[1], (int) Math.round(values[2]));
    }
}
