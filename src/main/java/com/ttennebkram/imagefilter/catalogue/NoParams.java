package com.ttennebkram.imagefilter.catalogue;

/**
 * Payload of filters without parameters (Invert, Grayscale, Equalize).
 */
public final class NoParams extends FilterParams {

    public static final NoParams INSTANCE = new NoParams();

    private NoParams() {
    }

    @Override
    public ParamShape getShape() {
        return ParamShape.NONE;
    }

    @Override
    public double[] values() {
        return new double[0];
    }

    @Override
    public FilterParams withValues(double[] values) {
        checkArity(values, 0, NoParams.class);
        return INSTANCE;
    }
}
