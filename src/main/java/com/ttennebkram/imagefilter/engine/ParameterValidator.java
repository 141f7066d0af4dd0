package com.ttennebkram.imagefilter.engine;

import com.ttennebkram.imagefilter.catalogue.FilterKind;
import com.ttennebkram.imagefilter.catalogue.FilterParams;
import com.ttennebkram.imagefilter.catalogue.FilterSpec;
import com.ttennebkram.imagefilter.catalogue.InvalidPayloadShapeException;
import com.ttennebkram.imagefilter.catalogue.ParamInfo;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Clamps and rounds filter payloads to the ranges their kind declares.
 *
 * Every component is clamped into [min, max] and rounded half up to
 * {@code roundTo} decimal places. The rounding grid is first snapped inside the
 * range (min rounded up, max rounded down) so a rounded value never leaves it,
 * which makes validation idempotent. NaN falls back to the kind's default.
 */
public final class ParameterValidator {

    private ParameterValidator() {
    }

    /**
     * @throws InvalidPayloadShapeException if the payload does not match the kind
     */
    public static FilterParams validate(FilterKind kind, FilterParams params) {
        FilterSpec.checkShape(kind, params);
        if (!kind.hasParams()) {
            return params;
        }

        List<ParamInfo> infos = kind.getParams();
        double[] values = params.values();
        double[] defaults = kind.getDefaultParams().values();
        double[] validated = new double[values.length];
        boolean changed = false;
        for (int i = 0; i < values.length; i++) {
            double value = Double.isNaN(values[i]) ? defaults[i] : values[i];
            validated[i] = clampAndRound(value, infos.get(i));
            if (Double.compare(validated[i], values[i]) != 0) {
                changed = true;
            }
        }
        return changed ? params.withValues(validated) : params;
    }

    public static FilterSpec validate(FilterSpec spec) {
        FilterParams validated = validate(spec.getKind(), spec.getParams());
        return validated == spec.getParams() ? spec : FilterSpec.of(spec.getKind(), validated);
    }

    /**
     * Clamp a single value to the descriptor's range and round it to its precision.
     */
    public static double clampAndRound(double value, ParamInfo info) {
        double min = info.getMin();
        double max = info.getMax();
        double clamped = Math.max(min, Math.min(max, value));

        int scale = info.getRoundTo();
        BigDecimal low = BigDecimal.valueOf(min).setScale(scale, RoundingMode.CEILING);
        BigDecimal high = BigDecimal.valueOf(max).setScale(scale, RoundingMode.FLOOR);
        if (low.compareTo(high) > 0) {
            // no grid point inside the range
            return clamped;
        }

        BigDecimal rounded = BigDecimal.valueOf(clamped).setScale(scale, RoundingMode.HALF_UP);
        if (rounded.compareTo(low) < 0) {
            rounded = low;
        } else if (rounded.compareTo(high) > 0) {
            rounded = high;
        }
        double result = rounded.doubleValue();
        // normalise -0.0 so equal payloads compare equal
        return result == 0.0 ? 0.0 : result;
    }
}
