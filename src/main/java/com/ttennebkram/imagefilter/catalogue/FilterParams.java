package com.ttennebkram.imagefilter.catalogue;

import java.util.Arrays;

/**
 * Immutable parameter payload of a filter.
 *
 * Every payload exposes its numeric components in declaration order, matching the
 * {@link ParamInfo} list of its {@link FilterKind}, and can be rebuilt from a
 * component array of the same length. Non-numeric choices are encoded as numbers:
 * booleans as 0/1, enums as ordinals, colours as packed 0xRRGGBB.
 */
public abstract class FilterParams {

    public abstract ParamShape getShape();

    /**
     * Numeric components in declaration order. Returns a fresh array.
     */
    public abstract double[] values();

    /**
     * Build a payload of the same type from the given components.
     *
     * @throws InvalidPayloadShapeException if the array length does not match
     */
    public abstract FilterParams withValues(double[] values);

    public int arity() {
        return values().length;
    }

    /**
     * Stable textual form of the components, used in cache keys and logs.
     */
    public String canonicalString() {
        double[] values = values();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(Double.toString(values[i]));
        }
        return sb.toString();
    }

    protected static void checkArity(double[] values, int expected, Class<?> type) {
        if (values == null || values.length != expected) {
            throw new InvalidPayloadShapeException(type.getSimpleName() + " expects " + expected
                    + " components, got " + (values == null ? "null" : values.length));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(values(), ((FilterParams) o).values());
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + Arrays.hashCode(values());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + Arrays.toString(values());
    }
}
