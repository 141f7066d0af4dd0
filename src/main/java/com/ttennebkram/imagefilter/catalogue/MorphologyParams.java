package com.ttennebkram.imagefilter.catalogue;

/**
 * Structuring element for dilation, erosion, opening and closing.
 */
public final class MorphologyParams extends FilterParams {

    private final int size;
    private final boolean circle;

    public MorphologyParams(int size, boolean circle) {
        this.size = size;
        this.circle = circle;
    }

    /** Kernel side length in pixels */
    public int getSize() {
        return size;
    }

    /** Elliptical kernel when true, square otherwise */
    public boolean isCircle() {
        return circle;
    }

    @Override
    public ParamShape getShape() {
        return ParamShape.RECORD;
    }

    @Override
    public double[] values() {
        return new double[]{size, circle ? 1 : 0};
    }

    @Override
    public MorphologyParams withValues(double[] values) {
        checkArity(values, 2, MorphologyParams.class);
        return new MorphologyParams((int) Math.round(values[0]), values[1] >= 0.5);
    }
}
