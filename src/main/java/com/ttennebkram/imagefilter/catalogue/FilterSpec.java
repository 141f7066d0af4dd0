package com.ttennebkram.imagefilter.catalogue;

import java.util.Objects;

/**
 * One filter with its parameter payload. Immutable value object.
 */
public final class FilterSpec {

    private final FilterKind kind;
    private final FilterParams params;

    private FilterSpec(FilterKind kind, FilterParams params) {
        this.kind = kind;
        this.params = params;
    }

    /**
     * Spec with the kind's default payload.
     */
    public static FilterSpec of(FilterKind kind) {
        Objects.requireNonNull(kind, "kind");
        return new FilterSpec(kind, kind.getDefaultParams());
    }

    /**
     * @throws InvalidPayloadShapeException if the payload type or arity does not match the kind
     */
    public static FilterSpec of(FilterKind kind, FilterParams params) {
        Objects.requireNonNull(kind, "kind");
        checkShape(kind, params);
        return new FilterSpec(kind, params);
    }

    /**
     * Spec built from raw components in declaration order.
     */
    public static FilterSpec of(FilterKind kind, double... values) {
        Objects.requireNonNull(kind, "kind");
        if (values.length != kind.getArity()) {
            throw new InvalidPayloadShapeException(kind + " expects " + kind.getArity()
                    + " parameters, got " + values.length);
        }
        return new FilterSpec(kind, kind.getDefaultParams().withValues(values));
    }

    public static void checkShape(FilterKind kind, FilterParams params) {
        if (params == null) {
            throw new InvalidPayloadShapeException(kind + " requires a " + kind.getShape() + " payload, got null");
        }
        if (params.getClass() != kind.getParamsType()) {
            throw new InvalidPayloadShapeException(kind + " requires " + kind.getParamsType().getSimpleName()
                    + " (" + kind.getShape() + "), got " + params.getClass().getSimpleName());
        }
        if (params.arity() != kind.getArity()) {
            throw new InvalidPayloadShapeException(kind + " expects " + kind.getArity()
                    + " parameters, got " + params.arity());
        }
    }

    public FilterKind getKind() {
        return kind;
    }

    public FilterParams getParams() {
        return params;
    }

    public FilterSpec withParams(FilterParams newParams) {
        return of(kind, newParams);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterSpec other)) return false;
        return kind == other.kind && params.equals(other.params);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + params.hashCode();
    }

    @Override
    public String toString() {
        return kind + "(" + params.canonicalString() + ")";
    }
}
