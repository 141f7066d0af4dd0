package com.ttennebkram.imagefilter.catalogue;

import java.util.Objects;

/**
 * Descriptor of one numeric parameter component: its name, inclusive valid range
 * and the number of decimal digits it is rounded to (0 means integer).
 */
public final class ParamInfo {

    /** Rounding used when none is given */
    public static final int DEFAULT_ROUND_TO = 2;

    private final String name;
    private final double min;
    private final double max;
    private final int roundTo;

    private ParamInfo(String name, double min, double max, int roundTo) {
        Objects.requireNonNull(name, "name");
        if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
            throw new IllegalArgumentException("Invalid range for " + name + ": " + min + ".." + max);
        }
        if (roundTo < 0) {
            throw new IllegalArgumentException("roundTo must not be negative: " + roundTo);
        }
        this.name = name;
        this.min = min;
        this.max = max;
        this.roundTo = roundTo;
    }

    public static ParamInfo of(String name, double min, double max, int roundTo) {
        return new ParamInfo(name, min, max, roundTo);
    }

    public static ParamInfo of(String name, double min, double max) {
        return new ParamInfo(name, min, max, DEFAULT_ROUND_TO);
    }

    public String getName() {
        return name;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public int getRoundTo() {
        return roundTo;
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParamInfo other)) return false;
        return Double.compare(min, other.min) == 0 && Double.compare(max, other.max) == 0
                && roundTo == other.roundTo && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, min, max, roundTo);
    }

    @Override
    public String toString() {
        return name + " [" + min + ".." + max + ", roundTo=" + roundTo + "]";
    }
}
