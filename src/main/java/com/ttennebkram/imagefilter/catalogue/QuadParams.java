package com.ttennebkram.imagefilter.catalogue;

public final class QuadParams extends FilterParams {

    private final double first;
    private final double second;
    private final double third;
    private final double fourth;

    public QuadParams(double first, double second, double third, double fourth) {
        this.first = first;
        this.second = second;
        this.third = third;
        this.fourth = fourth;
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

    public double getFourth() {
        return fourth;
    }

    @Override
    public ParamShape getShape() {
        return ParamShape.QUAD;
    }

    @Override
    public double[] values() {
        return new double[]{first, second, third, fourth};
    }

    @Override
    public QuadParams withValues(double[] values) {
        checkArity(values, 4, QuadParams.class);
        return new QuadParams(values[0], values[1], values[2], values[3]);
    }
}
