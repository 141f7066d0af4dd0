package com.ttennebkram.imagefilter.catalogue;

public final class PairParams extends FilterParams {

    private final double first;
    private final double second;

    public PairParams(double first, double second) {
        this.first = first;
        this.second = second;
    }

    public double getFirst() {
        return first;
    }

    public double getSecond() {
        return second;
    }

    @Override
    public ParamShape getShape() {
        return ParamShape.PAIR;
    }

    @Override
    public double[] values() {
        return new double[]{first, second};
    }

    @Override
    public PairParams withValues(double[] values) {
        checkArity(values, 2, PairParams.class);
        return new PairParams(values[0], values[1]);
    }
}
