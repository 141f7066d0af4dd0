package com.ttennebkram.imagefilter.catalogue;

public final class GaussianBlurParams extends FilterParams {

    private final int radius;
    private final EdgeMode edgeMode;

    public GaussianBlurParams(int radius, EdgeMode edgeMode) {
        this.radius = radius;
        this.edgeMode = edgeMode == null ? EdgeMode.REFLECT_101 : edgeMode;
    }

    public int getRadius() {
        return radius;
    }

    public EdgeMode getEdgeMode() {
        return edgeMode;
    }

    @Override
    public ParamShape getShape() {
        return ParamShape.RECORD;
    }

    @Override
    public double[] values() {
        return new double[]{radius, edgeMode.ordinal()};
    }

    @Override
    public GaussianBlurParams withValues(double[] values) {
        checkArity(values, 2, GaussianBlurParams.class);
        return new GaussianBlurParams((int) Math.round(values[0]),
                EdgeMode.fromOrdinal((int) Math.round(values[1])));
    }
}
