package com.ttennebkram.imagefilter.catalogue;

public final class ScalarParams extends FilterParams {

    private final double value;

    public ScalarParams(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public ParamShape getShape() {
        return ParamShape.SCALAR;
    }

    @Override
    public double[] values() {
        return new double[]{value};
    }

    @Override
    public ScalarParams withValues(double[] values) {
        checkArity(values, 1, ScalarParams.class);
        return new ScalarParams(values[0]);
    }
}
