package com.ttennebkram.imagefilter.catalogue;

public final class TripleParams extends FilterParams {

    private final double first;
    private final double second;
    private final double third;

    public TripleParams(double first, double second, double third) {
        this.first = first;
        this.second = second;
        this.third = third;
    }

    public double getFirst() {
        return first;
    }

    public double getSecond() {
        return second;
    }

    public double getThird() {
        return third;
    }

    @Override
    public ParamShape getShape() {
        return ParamShape.TRIPLE;
    }

    @Override
    public double[] values() {
        return new double[]{first, second, third};
    }

    @Override
    public TripleParams withValues(double[] values) {
        checkArity(values, 3, TripleParams.class);
        return new TripleParams(values[0], values[1], values[2]);
    }
}
